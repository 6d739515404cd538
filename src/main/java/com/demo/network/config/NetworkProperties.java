package com.demo.network.config;

import com.demo.network.model.OpportunityCategory;
import com.demo.network.service.scoring.FactorKind;
import com.demo.network.service.scoring.ScoreType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for discovery, scoring, generation and notification, bound from {@code network.*}.
 * Defaults match the values documented in application.yml so tests can use {@code new NetworkProperties()}.
 */
@Data
@ConfigurationProperties(prefix = "network")
public class NetworkProperties {

    private Discovery discovery = new Discovery();
    private Scoring scoring = new Scoring();
    private Opportunity opportunity = new Opportunity();
    private Notification notification = new Notification();
    private Batch batch = new Batch();
    private Narrative narrative = new Narrative();

    @Data
    public static class Discovery {
        private double confidenceFloor = 0.3;
        private int maxContactsForFullScan = 2000;
        private long maxPairs = 250_000;
        private int maxCandidatesPerContact = 5;
        /** 0 keeps rejections forever. */
        private int rejectionExpiryDays = 0;
        private double companyWeight = 0.3;
        private double domainWeight = 0.2;
        private double locationWeight = 0.15;
        private double roleWeight = 0.15;
        private double mutualWeight = 0.2;
    }

    @Data
    public static class Scoring {
        private String weightsVersion = "2024-06-v2";
        private FactorWeights priority = FactorWeights.of(0.15, 0.25, 0.15, 0.10, 0.25, 0.10);
        private FactorWeights opportunity = FactorWeights.of(0.25, 0.10, 0.15, 0.10, 0.05, 0.35);
        private FactorWeights strategic = FactorWeights.of(0.35, 0.05, 0.15, 0.30, 0.05, 0.10);
        private List<String> userGoals = new ArrayList<>();

        public FactorWeights weightsFor(ScoreType type) {
            return switch (type) {
                case PRIORITY -> priority;
                case OPPORTUNITY -> opportunity;
                case STRATEGIC -> strategic;
            };
        }
    }

    @Data
    public static class FactorWeights {
        private double networkPosition;
        private double relationshipStrength;
        private double professionalRelevance;
        private double mutualConnections;
        private double engagementPatterns;
        private double opportunityIndicators;

        public static FactorWeights of(double networkPosition, double relationshipStrength,
                                       double professionalRelevance, double mutualConnections,
                                       double engagementPatterns, double opportunityIndicators) {
            FactorWeights w = new FactorWeights();
            w.networkPosition = networkPosition;
            w.relationshipStrength = relationshipStrength;
            w.professionalRelevance = professionalRelevance;
            w.mutualConnections = mutualConnections;
            w.engagementPatterns = engagementPatterns;
            w.opportunityIndicators = opportunityIndicators;
            return w;
        }

        public double weightOf(FactorKind kind) {
            return switch (kind) {
                case NETWORK_POSITION -> networkPosition;
                case RELATIONSHIP_STRENGTH -> relationshipStrength;
                case PROFESSIONAL_RELEVANCE -> professionalRelevance;
                case MUTUAL_CONNECTIONS -> mutualConnections;
                case ENGAGEMENT_PATTERNS -> engagementPatterns;
                case OPPORTUNITY_INDICATORS -> opportunityIndicators;
            };
        }

        public double sum() {
            double s = 0;
            for (FactorKind k : FactorKind.values()) s += weightOf(k);
            return s;
        }
    }

    @Data
    public static class Opportunity {
        private int reconnectionDays = 90;
        private int maxDormancyDays = 730;
        private double highTierPriorityScore = 70;
        private double introMinStrength = 0.6;
        private double introMinConfidence = 0.4;
        private int clusterMinSize = 3;
        private double clusterMinStrategicValue = 60;
        private double minConfidence = 0.3;
        private int maxPerRun = 50;
        private List<String> interestKeywords = new ArrayList<>();
        private Map<OpportunityCategory, Integer> expiryDays = defaultExpiry();

        private static Map<OpportunityCategory, Integer> defaultExpiry() {
            Map<OpportunityCategory, Integer> m = new EnumMap<>(OpportunityCategory.class);
            m.put(OpportunityCategory.RECONNECTION, 30);
            m.put(OpportunityCategory.INTRODUCTION, 21);
            m.put(OpportunityCategory.STRATEGIC_MOVE, 45);
            m.put(OpportunityCategory.BUSINESS_MATCH, 30);
            m.put(OpportunityCategory.NETWORK_EXPANSION, 60);
            return m;
        }
    }

    @Data
    public static class Notification {
        private int expiringWindowDays = 3;
        private int digestSize = 5;
        private int newWindowHours = 24;
        private String webhookUrl = "";
    }

    @Data
    public static class Batch {
        private int chunkSize = 50;
    }

    @Data
    public static class Narrative {
        private String baseUrl = "";
        private long timeoutMs = 3000;
    }
}

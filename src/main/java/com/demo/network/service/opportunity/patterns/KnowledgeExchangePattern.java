package com.demo.network.service.opportunity.patterns;

import com.demo.network.model.Contact;
import com.demo.network.model.OpportunityCategory;
import com.demo.network.model.OpportunityType;
import com.demo.network.model.RelationshipType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Senior people in an interest area with whom a mentoring-style exchange would widen the network. */
@Component
public class KnowledgeExchangePattern implements OpportunityPattern {

    static final double MIN_CONFIDENCE = 0.4;
    static final double URGENCY = 80;

    private static final Set<RelationshipType> LEARNING_TYPES = EnumSet.of(
            RelationshipType.MENTOR, RelationshipType.MENTEE, RelationshipType.COLLEAGUE);
    private static final Set<RelationshipType> COMMERCIAL_TYPES = EnumSet.of(
            RelationshipType.CLIENT, RelationshipType.PROSPECT, RelationshipType.VENDOR);

    @Override
    public String name() {
        return "knowledge-exchange";
    }

    @Override
    public List<OpportunityDraft> detect(PatternContext ctx) {
        Set<String> interests = ctx.interests();
        if (interests.isEmpty()) return List.of();

        List<OpportunityDraft> out = new ArrayList<>();
        for (Contact c : ctx.activeContacts()) {
            if (COMMERCIAL_TYPES.contains(c.relationshipType())) continue;
            String matched = ctx.matchedInterest(c, interests);
            if (matched == null) continue;

            List<String> evidence = new ArrayList<>();
            double confidence = 0;
            double impact = 0;
            if (BusinessMatchPattern.decisionPower(c.position()) >= BusinessMatchPattern.PROSPECT_MIN_DECISION_POWER) {
                confidence += 0.3;
                impact += 40;
                evidence.add("Senior expertise in " + matched);
            }
            if (LEARNING_TYPES.contains(c.relationshipType())) {
                confidence += 0.3;
                impact += 30;
                evidence.add("Two-way learning relationship: " + c.relationshipType());
            }
            if (ctx.isWarm(c)) {
                confidence += 0.2;
                impact += 20;
                evidence.add("Recent conversation to build on");
            }
            if (confidence < MIN_CONFIDENCE) continue;

            out.add(OpportunityDraft.builder()
                    .category(OpportunityCategory.NETWORK_EXPANSION)
                    .type(OpportunityType.KNOWLEDGE_EXCHANGE)
                    .title("Knowledge exchange with " + c.displayName())
                    .description(String.format("Trade notes on %s with %s.", matched, c.displayName()))
                    .confidence(Math.round(confidence * 100) / 100.0)
                    .urgency(URGENCY)
                    .pathStrength(RelationshipType.bondStrengthOf(c.relationshipType()))
                    .impactOverride(Math.min(100.0, impact))
                    .primaryContactId(c.id())
                    .pathSignature("knowledge")
                    .evidenceFactors(evidence)
                    .build());
        }
        return out;
    }
}

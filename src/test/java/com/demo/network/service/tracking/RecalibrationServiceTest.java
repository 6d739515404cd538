package com.demo.network.service.tracking;

import com.demo.network.config.NetworkProperties;
import com.demo.network.model.OpportunityStatus;
import com.demo.network.model.OpportunitySuggestion;
import com.demo.network.support.Fixtures;
import com.demo.network.support.InMemoryFeedbackRepository;
import com.demo.network.support.InMemoryOpportunityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.demo.network.support.Fixtures.ACCOUNT;
import static com.demo.network.support.Fixtures.NOW;
import static com.demo.network.support.Fixtures.suggestion;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecalibrationService")
class RecalibrationServiceTest {

    private InMemoryOpportunityRepository opportunities;
    private NetworkProperties properties;
    private RecalibrationService service;

    @BeforeEach
    void setUp() {
        opportunities = new InMemoryOpportunityRepository();
        properties = Fixtures.properties();
        SuccessTrackingService tracking = new SuccessTrackingService(opportunities, new InMemoryFeedbackRepository(),
                Fixtures.clock());
        service = new RecalibrationService(tracking, properties, Fixtures.clock());
    }

    private static SuccessMetrics metrics(int considered, double acceptance, Map<String, Double> byCategory) {
        return new SuccessMetrics(ACCOUNT, 30, considered, considered, acceptance, 80, 90,
                1, 1, 2, 2, byCategory, Map.of(), Map.of(), 0, 0, 0, 75, considered, considered, NOW);
    }

    private static Optional<Recommendation> find(List<Recommendation> recs, RecommendationKind kind) {
        return recs.stream().filter(r -> r.kind() == kind).findFirst();
    }

    @Test
    @DisplayName("43 of 50 suggestions accepted raises the confidence floor")
    void highAcceptance_raise() {
        for (int i = 0; i < 50; i++) {
            OpportunitySuggestion.OpportunitySuggestionBuilder b = suggestion("s" + i);
            if (i < 43) b.status(OpportunityStatus.ACCEPTED).actedAt(NOW);
            opportunities.add(b.build());
        }

        RecalibrationReport report = service.report(ACCOUNT, 30);

        assertEquals(86.0, report.metrics().acceptanceRate());
        Recommendation raise = find(report.recommendations(), RecommendationKind.RAISE_CONFIDENCE_FLOOR).orElseThrow();
        assertEquals(0.3, raise.currentValue());
        assertEquals(0.35, raise.suggestedValue());
        assertEquals("2024-06-v2", report.weightsVersion());
    }

    @Test
    @DisplayName("low acceptance lowers the floor, clamped at zero")
    void lowAcceptance_lower() {
        properties.getOpportunity().setMinConfidence(0.02);

        List<Recommendation> recs = service.recommendAdjustments(metrics(20, 10, Map.of()));

        Recommendation lower = find(recs, RecommendationKind.LOWER_CONFIDENCE_FLOOR).orElseThrow();
        assertEquals(0.0, lower.suggestedValue());
        assertTrue(find(recs, RecommendationKind.RAISE_CONFIDENCE_FLOOR).isEmpty());
    }

    @Test
    @DisplayName("a category more than 20 points behind the best is flagged")
    void trailingCategory() {
        List<Recommendation> recs = service.recommendAdjustments(metrics(20, 50,
                Map.of("INTRODUCTION", 70.0, "RECONNECTION", 45.0, "STRATEGIC_MOVE", 55.0)));

        List<String> flagged = recs.stream()
                .filter(r -> r.kind() == RecommendationKind.CATEGORY_UNDERPERFORMING)
                .map(Recommendation::subject)
                .toList();
        assertEquals(List.of("RECONNECTION"), flagged);
    }

    @Test
    @DisplayName("no suggestions means no advice")
    void empty_noAdvice() {
        assertTrue(service.report(ACCOUNT, 30).recommendations().isEmpty());
    }

    @Test
    @DisplayName("mid-range acceptance with healthy metrics gives no advice")
    void healthy_noAdvice() {
        assertTrue(service.recommendAdjustments(metrics(20, 50, Map.of())).isEmpty());
    }
}

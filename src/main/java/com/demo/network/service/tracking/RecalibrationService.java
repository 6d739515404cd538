package com.demo.network.service.tracking;

import com.demo.network.config.NetworkProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rule-based advice derived from {@link SuccessMetrics}. Nothing here changes configuration;
 * the report names the weights version it was computed against.
 */
@Service
public class RecalibrationService {

    static final double HIGH_ACCEPTANCE = 80;
    static final double LOW_ACCEPTANCE = 30;
    static final double LOW_COMPLETION = 50;
    static final double SLOW_ACTION_DAYS = 7;
    static final double CATEGORY_GAP = 20;
    static final double LOW_CONFIDENCE_ACCURACY = 0.7;
    static final double LOW_ENGAGEMENT = 50;
    static final double FLOOR_STEP = 0.05;

    private final SuccessTrackingService trackingService;
    private final NetworkProperties properties;
    private final Clock clock;

    public RecalibrationService(SuccessTrackingService trackingService, NetworkProperties properties, Clock clock) {
        this.trackingService = trackingService;
        this.properties = properties;
        this.clock = clock;
    }

    public RecalibrationReport report(String accountId, int windowDays) {
        SuccessMetrics metrics = trackingService.computeMetrics(accountId, windowDays);
        return new RecalibrationReport(accountId, properties.getScoring().getWeightsVersion(), metrics,
                recommendAdjustments(metrics), clock.instant());
    }

    public List<Recommendation> recommendAdjustments(SuccessMetrics m) {
        List<Recommendation> out = new ArrayList<>();
        if (m.consideredSuggestions() == 0) {
            return out;
        }

        double floor = properties.getOpportunity().getMinConfidence();
        if (m.acceptanceRate() > HIGH_ACCEPTANCE) {
            out.add(new Recommendation(RecommendationKind.RAISE_CONFIDENCE_FLOOR, "network.opportunity.min-confidence",
                    String.format(Locale.ROOT, "Acceptance rate is %.1f%%; raise the confidence threshold to surface fewer, stronger suggestions", m.acceptanceRate()),
                    floor, step(floor, FLOOR_STEP)));
        } else if (m.acceptanceRate() < LOW_ACCEPTANCE) {
            out.add(new Recommendation(RecommendationKind.LOWER_CONFIDENCE_FLOOR, "network.opportunity.min-confidence",
                    String.format(Locale.ROOT, "Acceptance rate is %.1f%%; lower the confidence threshold to widen the candidate pool", m.acceptanceRate()),
                    floor, step(floor, -FLOOR_STEP)));
        }

        if (m.acceptedCount() > 0 && m.completionRate() < LOW_COMPLETION) {
            out.add(Recommendation.advisory(RecommendationKind.IMPROVE_ACTIONABILITY, "completion",
                    String.format(Locale.ROOT, "Only %.1f%% of accepted opportunities are completed; break them into smaller actions", m.completionRate())));
        }
        if (m.actedCount() > 0 && m.averageTimeToActionDays() > SLOW_ACTION_DAYS) {
            out.add(Recommendation.advisory(RecommendationKind.IMPROVE_URGENCY, "time-to-action",
                    String.format(Locale.ROOT, "Users take %.1f days on average to act; improve urgency indicators", m.averageTimeToActionDays())));
        }

        out.addAll(trailingCategories(m.successRateByCategory()));

        if (m.closedWithOutcome() > 0 && m.confidenceAccuracy() < LOW_CONFIDENCE_ACCURACY) {
            out.add(Recommendation.advisory(RecommendationKind.RECALIBRATE_CONFIDENCE, "confidence",
                    String.format(Locale.ROOT, "Confidence predicted the outcome in %.0f%% of closed opportunities; recalibrate confidence scoring", m.confidenceAccuracy() * 100)));
        }
        if (m.userEngagementScore() < LOW_ENGAGEMENT) {
            out.add(Recommendation.advisory(RecommendationKind.IMPROVE_ENGAGEMENT, "engagement",
                    String.format(Locale.ROOT, "Engagement score is %.0f/100; add more context to each suggestion", m.userEngagementScore())));
        }
        return out;
    }

    private List<Recommendation> trailingCategories(Map<String, Double> rates) {
        List<Recommendation> out = new ArrayList<>();
        if (rates.size() < 2) return out;
        double best = rates.values().stream().mapToDouble(Double::doubleValue).max().orElse(0);
        rates.forEach((category, rate) -> {
            if (best - rate > CATEGORY_GAP) {
                out.add(new Recommendation(RecommendationKind.CATEGORY_UNDERPERFORMING, category,
                        String.format(Locale.ROOT, "%s succeeds %.1f%% of the time, %.1f points behind the best category",
                                category, rate, best - rate),
                        rate, best));
            }
        });
        return out;
    }

    private static double step(double value, double delta) {
        double v = Math.max(0, Math.min(1, value + delta));
        return Math.round(v * 100) / 100.0;
    }
}

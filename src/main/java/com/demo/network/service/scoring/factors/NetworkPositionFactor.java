package com.demo.network.service.scoring.factors;

import com.demo.network.model.NetworkAnalytics;
import com.demo.network.service.scoring.FactorKind;
import com.demo.network.service.scoring.FactorScore;
import com.demo.network.service.scoring.ScoringContext;
import com.demo.network.service.scoring.ScoringFactor;
import org.springframework.stereotype.Component;

@Component
public class NetworkPositionFactor implements ScoringFactor {

    static final double NO_ANALYTICS_SCORE = 20;

    @Override
    public FactorKind kind() {
        return FactorKind.NETWORK_POSITION;
    }

    @Override
    public FactorScore compute(ScoringContext context) {
        NetworkAnalytics analytics = context.contact().analytics();
        if (analytics == null) {
            return FactorScore.of(kind(), NO_ANALYTICS_SCORE, "No network analytics available yet");
        }
        double influence = Math.min(100, analytics.influenceScore() * 100);
        double connections = Math.min(100, Math.log10(analytics.totalConnections() + 1) * 25);
        double centrality = Math.min(100, analytics.betweennessCentrality() * 100);
        double score = Math.round(influence * 0.4 + connections * 0.3 + centrality * 0.3);
        return FactorScore.of(kind(), clamp(score), String.format(
                "Network influence: %d/100, Connections: %d, Centrality: %d/100",
                Math.round(influence), analytics.totalConnections(), Math.round(centrality)));
    }

    private static double clamp(double v) {
        return Math.max(0, Math.min(100, v));
    }
}

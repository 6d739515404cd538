package com.demo.network.service.scoring.factors;

import com.demo.network.model.EngagementStats;
import com.demo.network.service.scoring.FactorKind;
import com.demo.network.service.scoring.FactorScore;
import com.demo.network.service.scoring.ScoringContext;
import com.demo.network.service.scoring.ScoringFactor;
import org.springframework.stereotype.Component;

@Component
public class EngagementPatternsFactor implements ScoringFactor {

    private static final double NEUTRAL_CAMPAIGN_SCORE = 50;

    @Override
    public FactorKind kind() {
        return FactorKind.ENGAGEMENT_PATTERNS;
    }

    @Override
    public FactorScore compute(ScoringContext context) {
        EngagementStats e = context.contact().engagement();
        double responseRate = e.responseRate() * 100;
        // fewer touches score higher: over-contacted people are less receptive
        double outreachScore = e.outreachCount() == 0 ? 100 : Math.max(0, 100 - e.outreachCount() * 5);
        double campaign = e.campaignCount() == 0
                ? NEUTRAL_CAMPAIGN_SCORE
                : (double) e.campaignResponded() / e.campaignCount() * 100;
        double score = Math.round(responseRate * 0.4 + outreachScore * 0.3 + campaign * 0.3);

        return FactorScore.of(kind(), Math.min(100, score), String.format(
                "Response rate: %d%%, Outreach count: %d, Campaign performance: %d%%",
                Math.round(responseRate), e.outreachCount(), Math.round(campaign)));
    }
}

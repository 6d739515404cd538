package com.demo.network.service.scoring.factors;

import com.demo.network.model.Contact;
import com.demo.network.model.RelationshipType;
import com.demo.network.service.scoring.FactorKind;
import com.demo.network.service.scoring.FactorScore;
import com.demo.network.service.scoring.ScoringContext;
import com.demo.network.service.scoring.ScoringFactor;
import org.springframework.stereotype.Component;

/** Recency of the last touch, outreach frequency per month and the kind of relationship. */
@Component
public class RelationshipStrengthFactor implements ScoringFactor {

    private static final long DEFAULT_CONNECTION_AGE_DAYS = 365;

    @Override
    public FactorKind kind() {
        return FactorKind.RELATIONSHIP_STRENGTH;
    }

    @Override
    public FactorScore compute(ScoringContext context) {
        Contact c = context.contact();

        long daysSinceContact = context.daysSince(c.lastContactDate());
        double recency = daysSinceContact < 0 ? 0 : Math.max(0, 100 - (daysSinceContact / 30.0) * 20);

        long connectionAge = context.daysSince(c.connectionDate());
        if (connectionAge < 0) connectionAge = DEFAULT_CONNECTION_AGE_DAYS;
        double perMonth = connectionAge > 0 ? (double) c.engagement().outreachCount() / connectionAge * 30 : 0;

        int typeScore = RelationshipType.typeScoreOf(c.relationshipType());
        double score = Math.round(recency * 0.4 + Math.min(100, perMonth * 50) * 0.3 + typeScore * 0.3);

        String last = daysSinceContact < 0 ? "Never" : daysSinceContact + " days ago";
        return FactorScore.of(kind(), Math.min(100, score), String.format(
                "Last contact: %s, Contact frequency: %.1f/month, Relationship: %s",
                last, perMonth, c.relationshipType() == null ? "Unknown" : c.relationshipType()));
    }
}

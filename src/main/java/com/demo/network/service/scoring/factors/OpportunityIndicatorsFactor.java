package com.demo.network.service.scoring.factors;

import com.demo.network.model.Contact;
import com.demo.network.model.OpportunityFlag;
import com.demo.network.model.Relationship;
import com.demo.network.service.scoring.FactorKind;
import com.demo.network.service.scoring.FactorScore;
import com.demo.network.service.scoring.ScoringContext;
import com.demo.network.service.scoring.ScoringFactor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** Threshold rules over position, company and timing. The only factor that emits flags. */
@Component
public class OpportunityIndicatorsFactor implements ScoringFactor {

    static final int RECENT_UPDATE_DAYS = 30;
    static final int RECONNECT_MIN_DAYS = 90;
    static final int RECONNECT_MAX_DAYS = 365;
    static final double WARM_INTRO_STRENGTH = 0.6;

    @Override
    public FactorKind kind() {
        return FactorKind.OPPORTUNITY_INDICATORS;
    }

    @Override
    public FactorScore compute(ScoringContext context) {
        Contact c = context.contact();
        Set<OpportunityFlag> flags = EnumSet.noneOf(OpportunityFlag.class);
        double score = 0;

        long sinceUpdate = context.daysSince(c.updatedAt());
        if (sinceUpdate >= 0 && sinceUpdate < RECENT_UPDATE_DAYS && (c.position() != null || c.company() != null)) {
            flags.add(OpportunityFlag.RECENT_JOB_CHANGE);
            score += 25;
        }

        score += ProfessionalSignals.industryTrend(c.company()) * 0.3;

        if (ProfessionalSignals.roleExpansion(c.position())) {
            flags.add(OpportunityFlag.ROLE_EXPANSION_POTENTIAL);
            score += 20;
        }
        if (ProfessionalSignals.companyGrowth(c.company())) {
            flags.add(OpportunityFlag.COMPANY_GROWTH);
            score += 15;
        }

        long sinceContact = context.daysSince(c.lastContactDate());
        if (sinceContact > RECONNECT_MIN_DAYS && sinceContact < RECONNECT_MAX_DAYS) {
            flags.add(OpportunityFlag.RECONNECTION_OPPORTUNITY);
            score += 10;
        }

        if (ProfessionalSignals.seniority(c.position()) >= ProfessionalSignals.DECISION_MAKER_SENIORITY) {
            flags.add(OpportunityFlag.DECISION_MAKER);
            score += 10;
        }
        if (hasStrongEdge(context)) {
            flags.add(OpportunityFlag.WARM_INTRO_AVAILABLE);
            score += 10;
        }

        String reasoning = flags.isEmpty()
                ? "Opportunity flags: none"
                : "Opportunity flags: " + flags.stream()
                        .map(f -> f.name().toLowerCase(Locale.ROOT))
                        .collect(Collectors.joining(", "));
        return new FactorScore(kind(), Math.min(100, Math.round(score)), reasoning, flags);
    }

    private boolean hasStrongEdge(ScoringContext context) {
        for (Relationship r : context.graph().edgesOf(context.contact().id())) {
            if (r.strength() >= WARM_INTRO_STRENGTH) return true;
        }
        return false;
    }
}

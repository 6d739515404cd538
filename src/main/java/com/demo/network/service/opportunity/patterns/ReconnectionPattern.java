package com.demo.network.service.opportunity.patterns;

import com.demo.network.model.Contact;
import com.demo.network.model.OpportunityCategory;
import com.demo.network.model.OpportunityType;
import com.demo.network.model.RelationshipType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** High-value contacts that have gone quiet for longer than the reconnection window. */
@Component
public class ReconnectionPattern implements OpportunityPattern {

    static final double HALF_LIFE_DAYS = 365;

    @Override
    public String name() {
        return "reconnection";
    }

    @Override
    public List<OpportunityDraft> detect(PatternContext ctx) {
        List<OpportunityDraft> out = new ArrayList<>();
        int threshold = ctx.settings().getReconnectionDays();
        for (Contact c : ctx.activeContacts()) {
            if (!isHighValue(c, ctx)) continue;
            long days = ctx.dormantDays(c);
            if (days <= threshold || days > ctx.settings().getMaxDormancyDays()) continue;

            double bond = RelationshipType.bondStrengthOf(c.relationshipType());
            double responseRate = c.engagement().responseRate();
            double decay = Math.pow(0.5, (days - threshold) / HALF_LIFE_DAYS);
            double confidence = clampUnit((0.4 + 0.4 * bond + 0.2 * responseRate) * decay);

            double urgency = days > 365 ? 80 : days > 180 ? 60 : 40;
            if (c.opportunityScoreOrZero() > 70) urgency += 20;

            List<String> evidence = new ArrayList<>();
            evidence.add("No contact for " + days + " days");
            if (c.tier() != null) evidence.add("Contact tier " + c.tier());
            if (c.relationshipType() != null) evidence.add("Relationship: " + c.relationshipType());
            if (c.engagement().outreachCount() > 0) {
                evidence.add(String.format("Historic response rate %d%%", Math.round(responseRate * 100)));
            }

            out.add(OpportunityDraft.builder()
                    .category(OpportunityCategory.RECONNECTION)
                    .type(OpportunityType.DORMANT_RECONNECTION)
                    .title("Reconnect with " + c.displayName())
                    .description(String.format("%s%s has not heard from you in %d days.",
                            c.displayName(), c.company() == null ? "" : " at " + c.company(), days))
                    .confidence(round(confidence))
                    .urgency(Math.min(100, urgency))
                    .pathStrength(bond)
                    .primaryContactId(c.id())
                    .pathSignature("direct")
                    .evidenceFactors(evidence)
                    .build());
        }
        return out;
    }

    private boolean isHighValue(Contact c, PatternContext ctx) {
        return (c.tier() != null && c.tier().isHighTier())
                || c.priorityScoreOrZero() >= ctx.settings().getHighTierPriorityScore();
    }

    private static double clampUnit(double v) {
        return Math.max(0, Math.min(1, v));
    }

    private static double round(double v) {
        return Math.round(v * 10_000) / 10_000.0;
    }
}

package com.demo.network.service.opportunity.patterns;

import com.demo.network.model.Contact;
import com.demo.network.model.OpportunityCategory;
import com.demo.network.model.OpportunityType;
import com.demo.network.model.RelationshipType;
import com.demo.network.service.evidence.SeniorityLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Contacts in an industry the user cares about who are worth a commercial conversation.
 * Decision makers who are not yet clients become CLIENT_PROSPECT drafts; peers with enough
 * authority, especially at early-stage companies, become PARTNERSHIP drafts.
 */
@Component
public class BusinessMatchPattern implements OpportunityPattern {

    static final double PROSPECT_MIN_DECISION_POWER = 0.7;
    static final double PARTNER_MIN_DECISION_POWER = 0.5;
    static final double PARTNER_MIN_CONFIDENCE = 0.4;
    static final double PARTNERSHIP_URGENCY = 50;

    private static final Set<RelationshipType> NOT_PARTNER_MATERIAL = EnumSet.of(
            RelationshipType.CLIENT, RelationshipType.PROSPECT, RelationshipType.VENDOR, RelationshipType.INVESTOR);

    @Override
    public String name() {
        return "business-match";
    }

    @Override
    public List<OpportunityDraft> detect(PatternContext ctx) {
        Set<String> interests = ctx.interests();
        if (interests.isEmpty()) return List.of();

        List<OpportunityDraft> out = new ArrayList<>();
        for (Contact c : ctx.activeContacts()) {
            String matched = ctx.matchedInterest(c, interests);
            if (matched == null) continue;
            CompanyStage stage = CompanyStage.of(c.company());
            double power = decisionPower(c.position());
            clientProspect(c, matched, stage, power).ifPresent(out::add);
            partnership(ctx, c, matched, stage, power).ifPresent(out::add);
        }
        return out;
    }

    Optional<OpportunityDraft> clientProspect(Contact c, String matched, CompanyStage stage, double power) {
        if (c.relationshipType() == RelationshipType.CLIENT || power < PROSPECT_MIN_DECISION_POWER) {
            return Optional.empty();
        }
        List<String> evidence = new ArrayList<>();
        evidence.add("Works in " + matched);
        double confidence = 0.2;
        double impact = 20;

        if (stage == CompanyStage.ENTERPRISE) {
            confidence += 0.3;
            impact += 40;
            evidence.add("Large company with significant budget");
        } else if (stage == CompanyStage.MEDIUM) {
            confidence += 0.2;
            impact += 25;
            evidence.add("Mid-sized company");
        }

        confidence += 0.3 * power;
        impact += 30 * power;
        evidence.add("Decision maker: " + SeniorityLevel.of(c.position()).label());

        double score = c.opportunityScoreOrZero();
        if (score > 70) {
            confidence += 0.15;
            evidence.add(String.format("Opportunity score %d", Math.round(score)));
        }
        if (c.relationshipType() == RelationshipType.PROSPECT) {
            confidence += 0.1;
            evidence.add("Already marked as a prospect");
        } else if (c.relationshipType() == RelationshipType.COLLEAGUE || c.relationshipType() == RelationshipType.PARTNER) {
            confidence += 0.05;
            evidence.add("Existing professional relationship");
        }

        double urgency = score > 80 ? 90 : score > 60 ? 70 : 50;
        return Optional.of(draft(c, OpportunityType.CLIENT_PROSPECT, "client-prospect",
                "Client prospect: " + c.displayName(),
                String.format("%s could buy from you%s.", c.displayName(),
                        c.company() == null ? "" : " on behalf of " + c.company()),
                confidence, impact, urgency, evidence));
    }

    Optional<OpportunityDraft> partnership(PatternContext ctx, Contact c, String matched,
                                           CompanyStage stage, double power) {
        if (NOT_PARTNER_MATERIAL.contains(c.relationshipType()) || power < PARTNER_MIN_DECISION_POWER) {
            return Optional.empty();
        }
        List<String> evidence = new ArrayList<>();
        evidence.add("Shared market: " + matched);
        double confidence = 0.2;
        double impact = 30;

        if (stage == CompanyStage.STARTUP) {
            confidence += 0.2;
            impact += 20;
            evidence.add("Early-stage company open to partnerships");
        }
        if (c.strategicValueOrZero() > 80) {
            confidence += 0.1;
            impact += 25;
            evidence.add("High strategic value");
        }
        if (ctx.isWarm(c)) {
            confidence += 0.2;
            evidence.add("In touch within " + ctx.settings().getReconnectionDays() + " days");
        }
        if (c.relationshipType() == RelationshipType.COLLEAGUE || c.relationshipType() == RelationshipType.PARTNER) {
            confidence += 0.1;
            evidence.add("Existing professional relationship");
        }
        if (confidence < PARTNER_MIN_CONFIDENCE) return Optional.empty();

        return Optional.of(draft(c, OpportunityType.PARTNERSHIP, "partnership",
                "Partnership with " + (c.company() == null ? c.displayName() : c.company()),
                String.format("%s works in %s and may be open to a partnership.", c.displayName(), matched),
                confidence, impact, PARTNERSHIP_URGENCY, evidence));
    }

    /** C-level 1.0, VP 0.8, director 0.7, manager 0.5, anything else 0.3. */
    static double decisionPower(String position) {
        SeniorityLevel level = SeniorityLevel.of(position);
        if (level == null) return 0.3;
        return switch (level) {
            case C_LEVEL -> 1.0;
            case VP -> 0.8;
            case DIRECTOR -> 0.7;
            case MANAGER -> 0.5;
            case SENIOR -> 0.3;
        };
    }

    private static OpportunityDraft draft(Contact c, OpportunityType type, String signature, String title,
                                          String description, double confidence, double impact,
                                          double urgency, List<String> evidence) {
        return OpportunityDraft.builder()
                .category(OpportunityCategory.BUSINESS_MATCH)
                .type(type)
                .title(title)
                .description(description)
                .confidence(Math.round(Math.min(1, confidence) * 100) / 100.0)
                .urgency(urgency)
                .pathStrength(RelationshipType.bondStrengthOf(c.relationshipType()))
                .impactOverride(Math.round(Math.min(100, impact) * 10) / 10.0)
                .primaryContactId(c.id())
                .pathSignature(signature)
                .evidenceFactors(evidence)
                .build();
    }
}

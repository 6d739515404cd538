package com.demo.network.service.opportunity.patterns;

import com.demo.network.model.Contact;
import com.demo.network.model.OpportunityCategory;
import com.demo.network.model.OpportunityType;
import com.demo.network.model.Relationship;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A contact the user does not know well but who matches an interest, reachable in one hop
 * through a warm contact over a strong edge.
 */
@Component
public class IntroductionPattern implements OpportunityPattern {

    static final double URGENCY = 70;

    @Override
    public String name() {
        return "introduction";
    }

    @Override
    public List<OpportunityDraft> detect(PatternContext ctx) {
        Set<String> interests = ctx.interests();
        if (interests.isEmpty()) return List.of();

        List<OpportunityDraft> out = new ArrayList<>();
        for (Contact introducer : ctx.activeContacts()) {
            if (!ctx.isWarm(introducer)) continue;
            for (Relationship edge : ctx.graph().outgoing(introducer.id())) {
                if (edge.strength() < ctx.settings().getIntroMinStrength()) continue;
                Contact target = ctx.contactsById().get(edge.relatedContactId());
                if (target == null || !target.isActive() || ctx.isWarm(target)) continue;
                String matched = ctx.matchedInterest(target, interests);
                if (matched == null) continue;

                double confidence = edge.strength() * target.opportunityScoreOrZero() / 100.0;
                if (confidence < ctx.settings().getIntroMinConfidence()) continue;

                out.add(OpportunityDraft.builder()
                        .category(OpportunityCategory.INTRODUCTION)
                        .type(OpportunityType.WARM_INTRODUCTION)
                        .title("Introduction: meet " + target.displayName() + " through " + introducer.displayName())
                        .description(String.format("%s knows %s (%s) and can make a warm introduction.",
                                introducer.displayName(), target.displayName(), describe(target)))
                        .confidence(Math.round(confidence * 10_000) / 10_000.0)
                        .urgency(URGENCY)
                        .pathStrength(edge.strength())
                        .primaryContactId(target.id())
                        .secondaryContactId(introducer.id())
                        .pathSignature(introducer.id() + ">" + target.id())
                        .evidenceFactors(List.of(
                                "Matches interest: " + matched,
                                String.format("%s relationship strength %.2f", edge.type(), edge.strength()),
                                "Introducer contacted within " + ctx.settings().getReconnectionDays() + " days"))
                        .build());
            }
        }
        return out;
    }

    private static String describe(Contact c) {
        if (c.position() != null && c.company() != null) return c.position() + " at " + c.company();
        if (c.company() != null) return c.company();
        return c.position() == null ? "no role on file" : c.position();
    }
}

package com.demo.network.service.opportunity.patterns;

import com.demo.network.model.OpportunityCategory;
import com.demo.network.model.OpportunityType;
import lombok.Builder;

import java.util.List;

/**
 * What a pattern detected, before impact, priority, expiry and the dedupe key are attached.
 * {@code impactOverride} replaces the shared impact formula when a pattern sizes impact itself.
 */
@Builder
public record OpportunityDraft(
        OpportunityCategory category,
        OpportunityType type,
        String title,
        String description,
        double confidence,
        double urgency,
        double pathStrength,
        Double impactOverride,
        String primaryContactId,
        String secondaryContactId,
        String pathSignature,
        List<String> evidenceFactors
) {

    public OpportunityDraft {
        evidenceFactors = evidenceFactors == null ? List.of() : List.copyOf(evidenceFactors);
    }
}

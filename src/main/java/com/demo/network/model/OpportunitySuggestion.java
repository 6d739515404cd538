package com.demo.network.model;

import com.demo.network.exception.ValidationException;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * A ranked, actionable suggestion shown to the user. {@code dedupeKey} identifies the
 * (category, primary contact, path) triple so an open suggestion is never generated twice.
 */
@Builder(toBuilder = true)
public record OpportunitySuggestion(
        String id,
        String accountId,
        OpportunityCategory category,
        OpportunityType type,
        String title,
        String description,
        double confidenceScore,
        double impactScore,
        double urgencyScore,
        OpportunityPriority priority,
        OpportunityStatus status,
        String primaryContactId,
        String secondaryContactId,
        String dedupeKey,
        List<String> evidenceFactors,
        Instant createdAt,
        Instant expiresAt,
        Instant actedAt,
        Instant completedAt,
        OutcomeMetadata outcome
) {

    public OpportunitySuggestion {
        ValidationException.requireUnit("confidenceScore", confidenceScore);
        ValidationException.requirePercent("impactScore", impactScore);
        ValidationException.requirePercent("urgencyScore", urgencyScore);
        evidenceFactors = evidenceFactors == null ? List.of() : List.copyOf(evidenceFactors);
        status = status == null ? OpportunityStatus.PENDING : status;
    }

    /** confidence x impact x urgency / 100, the ranking key for feeds and digests. */
    public double compositeScore() {
        return confidenceScore * impactScore * (urgencyScore / 100.0);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}

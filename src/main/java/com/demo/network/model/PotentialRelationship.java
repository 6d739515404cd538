package com.demo.network.model;

import com.demo.network.exception.ValidationException;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/** An inferred, not yet reviewed edge between two contacts. */
@Builder(toBuilder = true)
public record PotentialRelationship(
        String id,
        String accountId,
        String contactId,
        String relatedContactId,
        RelationshipType inferredType,
        double confidence,
        List<EvidenceSignal> evidence,
        String fingerprint,
        CandidateStatus status,
        Instant createdAt,
        Instant reviewedAt
) {

    public PotentialRelationship {
        ValidationException.requireUnit("confidence", confidence);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        status = status == null ? CandidateStatus.PENDING : status;
    }

    public boolean isPending() {
        return status == CandidateStatus.PENDING;
    }
}

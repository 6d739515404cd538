package com.demo.network.repository;

import com.demo.network.model.CandidateStatus;
import com.demo.network.model.PotentialRelationship;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Storage for inferred relationships awaiting review. */
public interface CandidateRepository {

    Optional<PotentialRelationship> findCandidate(String fingerprint);

    Optional<PotentialRelationship> findById(String id);

    Optional<PotentialRelationship> findPendingForPair(String contactId, String otherContactId);

    List<PotentialRelationship> listPending(String accountId);

    /** Fingerprints are not unique: a candidate rejected long ago may be stored again. */
    PotentialRelationship create(PotentialRelationship candidate);

    /** Replaces evidence, confidence, type and fingerprint of a pending candidate. */
    void refresh(PotentialRelationship candidate);

    /** Compare-and-set on status; false when the stored status was not {@code expected}. */
    boolean updateStatus(String id, CandidateStatus expected, CandidateStatus next, Instant reviewedAt);
}

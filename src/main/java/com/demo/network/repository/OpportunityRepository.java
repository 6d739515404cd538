package com.demo.network.repository;

import com.demo.network.model.OpportunityStatus;
import com.demo.network.model.OpportunitySuggestion;
import com.demo.network.model.OutcomeMetadata;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface OpportunityRepository {

    OpportunitySuggestion create(OpportunitySuggestion suggestion);

    Optional<OpportunitySuggestion> findById(String id);

    /** PENDING or VIEWED suggestions whose expiry (if any) is after {@code now}. */
    List<OpportunitySuggestion> listPending(String accountId, Instant now);

    List<OpportunitySuggestion> listCreatedSince(String accountId, Instant since);

    /** PENDING or VIEWED suggestions whose expiry is at or before {@code now}. */
    List<OpportunitySuggestion> listOverdue(String accountId, Instant now);

    Optional<OpportunitySuggestion> findOpenByDedupeKey(String accountId, String dedupeKey);

    /**
     * Compare-and-set on status. {@code actedAt} and {@code completedAt} are only written
     * when non-null. Returns false when the stored status was not {@code expected}.
     */
    boolean updateStatus(String id, OpportunityStatus expected, OpportunityStatus next,
                         Instant actedAt, Instant completedAt);

    void recordOutcome(String id, OutcomeMetadata outcome);
}

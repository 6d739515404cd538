package com.demo.network.support;

import com.demo.network.model.OpportunityStatus;
import com.demo.network.model.OpportunitySuggestion;
import com.demo.network.model.OutcomeMetadata;
import com.demo.network.repository.OpportunityRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryOpportunityRepository implements OpportunityRepository {

    private final Map<String, OpportunitySuggestion> rows = new LinkedHashMap<>();

    public InMemoryOpportunityRepository add(OpportunitySuggestion... suggestions) {
        for (OpportunitySuggestion s : suggestions) rows.put(s.id(), s);
        return this;
    }

    public List<OpportunitySuggestion> all() {
        return new ArrayList<>(rows.values());
    }

    @Override
    public OpportunitySuggestion create(OpportunitySuggestion suggestion) {
        rows.put(suggestion.id(), suggestion);
        return suggestion;
    }

    @Override
    public Optional<OpportunitySuggestion> findById(String id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public List<OpportunitySuggestion> listPending(String accountId, Instant now) {
        return rows.values().stream()
                .filter(s -> accountId.equals(s.accountId()) && s.status().isOpen() && !s.isExpiredAt(now))
                .toList();
    }

    @Override
    public List<OpportunitySuggestion> listCreatedSince(String accountId, Instant since) {
        return rows.values().stream()
                .filter(s -> accountId.equals(s.accountId()) && !s.createdAt().isBefore(since))
                .toList();
    }

    @Override
    public List<OpportunitySuggestion> listOverdue(String accountId, Instant now) {
        return rows.values().stream()
                .filter(s -> accountId.equals(s.accountId()) && s.status().isOpen() && s.isExpiredAt(now))
                .toList();
    }

    @Override
    public Optional<OpportunitySuggestion> findOpenByDedupeKey(String accountId, String dedupeKey) {
        return rows.values().stream()
                .filter(s -> accountId.equals(s.accountId()) && dedupeKey.equals(s.dedupeKey()))
                .filter(s -> !s.status().isTerminal())
                .findFirst();
    }

    @Override
    public boolean updateStatus(String id, OpportunityStatus expected, OpportunityStatus next,
                                Instant actedAt, Instant completedAt) {
        OpportunitySuggestion s = rows.get(id);
        if (s == null || s.status() != expected) return false;
        rows.put(id, s.toBuilder()
                .status(next)
                .actedAt(actedAt != null ? actedAt : s.actedAt())
                .completedAt(completedAt != null ? completedAt : s.completedAt())
                .build());
        return true;
    }

    @Override
    public void recordOutcome(String id, OutcomeMetadata outcome) {
        OpportunitySuggestion s = rows.get(id);
        if (s != null) rows.put(id, s.toBuilder().outcome(outcome).build());
    }
}

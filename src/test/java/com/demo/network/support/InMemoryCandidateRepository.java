package com.demo.network.support;

import com.demo.network.model.CandidateStatus;
import com.demo.network.model.PotentialRelationship;
import com.demo.network.repository.CandidateRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class InMemoryCandidateRepository implements CandidateRepository {

    private final List<PotentialRelationship> rows = new ArrayList<>();

    public List<PotentialRelationship> all() {
        return List.copyOf(rows);
    }

    @Override
    public Optional<PotentialRelationship> findCandidate(String fingerprint) {
        // latest row wins, as in the SQL implementation
        for (int i = rows.size() - 1; i >= 0; i--) {
            if (rows.get(i).fingerprint().equals(fingerprint)) return Optional.of(rows.get(i));
        }
        return Optional.empty();
    }

    @Override
    public Optional<PotentialRelationship> findById(String id) {
        return rows.stream().filter(r -> r.id().equals(id)).findFirst();
    }

    @Override
    public Optional<PotentialRelationship> findPendingForPair(String contactId, String otherContactId) {
        return rows.stream()
                .filter(PotentialRelationship::isPending)
                .filter(r -> (r.contactId().equals(contactId) && r.relatedContactId().equals(otherContactId))
                        || (r.contactId().equals(otherContactId) && r.relatedContactId().equals(contactId)))
                .findFirst();
    }

    @Override
    public List<PotentialRelationship> listPending(String accountId) {
        return rows.stream()
                .filter(r -> accountId.equals(r.accountId()) && r.isPending())
                .sorted((a, b) -> Double.compare(b.confidence(), a.confidence()))
                .toList();
    }

    @Override
    public PotentialRelationship create(PotentialRelationship candidate) {
        rows.add(candidate);
        return candidate;
    }

    @Override
    public void refresh(PotentialRelationship candidate) {
        replace(candidate.id(), candidate);
    }

    @Override
    public boolean updateStatus(String id, CandidateStatus expected, CandidateStatus next, Instant reviewedAt) {
        Optional<PotentialRelationship> row = findById(id);
        if (row.isEmpty() || row.get().status() != expected) return false;
        replace(id, row.get().toBuilder().status(next).reviewedAt(reviewedAt).build());
        return true;
    }

    private void replace(String id, PotentialRelationship updated) {
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).id().equals(id)) {
                rows.set(i, updated);
                return;
            }
        }
    }
}

package com.demo.network.service.opportunity;

import com.demo.network.exception.ConflictException;
import com.demo.network.exception.NotFoundException;
import com.demo.network.model.OpportunityStatus;
import com.demo.network.model.OpportunitySuggestion;
import com.demo.network.repository.OpportunityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** User-driven status changes and the time-driven expiry sweep. */
@Slf4j
@Service
public class OpportunityLifecycleService {

    private final OpportunityRepository opportunityRepository;
    private final OpportunityStateMachine stateMachine;
    private final Clock clock;

    public OpportunityLifecycleService(OpportunityRepository opportunityRepository,
                                       OpportunityStateMachine stateMachine,
                                       Clock clock) {
        this.opportunityRepository = opportunityRepository;
        this.stateMachine = stateMachine;
        this.clock = clock;
    }

    public OpportunitySuggestion get(String id) {
        return opportunityRepository.findById(id).orElseThrow(() -> NotFoundException.of("Opportunity", id));
    }

    /**
     * Moves a suggestion to {@code next}. Asking for the current status is a no-op. A suggestion
     * whose expiry has passed is expired on the spot and the request is refused.
     *
     * @throws ConflictException when the move is not allowed or another writer changed the status first
     */
    public OpportunitySuggestion updateStatus(String id, OpportunityStatus next) {
        OpportunitySuggestion current = get(id);
        OpportunityStatus from = current.status();
        if (from == next) {
            return current;
        }
        Instant now = clock.instant();
        if (from.isOpen() && current.isExpiredAt(now) && next != OpportunityStatus.EXPIRED) {
            opportunityRepository.updateStatus(id, from, OpportunityStatus.EXPIRED, null, null);
            throw new ConflictException("Opportunity " + id + " expired at " + current.expiresAt());
        }
        if (!stateMachine.canTransition(from, next)) {
            throw new ConflictException("Invalid status transition " + from + " -> " + next + " for opportunity " + id);
        }
        Instant actedAt = stateMachine.marksAction(from, next) ? now : null;
        Instant completedAt = next == OpportunityStatus.COMPLETED ? now : null;
        if (!opportunityRepository.updateStatus(id, from, next, actedAt, completedAt)) {
            throw new ConflictException("Opportunity " + id + " was changed concurrently");
        }
        log.info("Opportunity {} transitioned: {} -> {}", id, from, next);
        return get(id);
    }

    /** Expires every open suggestion whose {@code expiresAt} has passed. Lost races are ignored. */
    public int expireOverdue(String accountId) {
        Instant now = clock.instant();
        int expired = 0;
        for (OpportunitySuggestion s : opportunityRepository.listOverdue(accountId, now)) {
            if (opportunityRepository.updateStatus(s.id(), s.status(), OpportunityStatus.EXPIRED, null, null)) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Expired {} opportunities for account {}", expired, accountId);
        }
        return expired;
    }

    /** Open, unexpired suggestions ranked by composite score. Overdue ones are expired first. */
    public List<OpportunitySuggestion> listActive(String accountId) {
        expireOverdue(accountId);
        List<OpportunitySuggestion> out = new ArrayList<>(opportunityRepository.listPending(accountId, clock.instant()));
        out.sort(Comparator.comparingDouble(OpportunitySuggestion::compositeScore).reversed()
                .thenComparing(OpportunitySuggestion::createdAt));
        return out;
    }
}

package com.demo.network.service.opportunity;

import com.demo.network.model.OpportunityStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Allowed status moves for an opportunity suggestion.
 *
 * <pre>
 * PENDING → VIEWED → ACCEPTED → IN_PROGRESS → COMPLETED
 *    ↘        ↘          ↘            ↘
 *     REJECTED / EXPIRED  REJECTED     REJECTED
 * </pre>
 *
 * PENDING may also go straight to ACCEPTED, and ACCEPTED straight to COMPLETED.
 * COMPLETED, REJECTED and EXPIRED are terminal.
 */
@Component
public class OpportunityStateMachine {

    public boolean canTransition(OpportunityStatus from, OpportunityStatus to) {
        return validNextStates(from).contains(to);
    }

    public Set<OpportunityStatus> validNextStates(OpportunityStatus from) {
        return switch (from) {
            case PENDING -> EnumSet.of(OpportunityStatus.VIEWED, OpportunityStatus.ACCEPTED,
                    OpportunityStatus.REJECTED, OpportunityStatus.EXPIRED);
            case VIEWED -> EnumSet.of(OpportunityStatus.ACCEPTED, OpportunityStatus.REJECTED, OpportunityStatus.EXPIRED);
            case ACCEPTED -> EnumSet.of(OpportunityStatus.IN_PROGRESS, OpportunityStatus.COMPLETED, OpportunityStatus.REJECTED);
            case IN_PROGRESS -> EnumSet.of(OpportunityStatus.COMPLETED, OpportunityStatus.REJECTED);
            case COMPLETED, REJECTED, EXPIRED -> EnumSet.noneOf(OpportunityStatus.class);
        };
    }

    /** The first move out of PENDING/VIEWED stamps {@code actedAt}. */
    public boolean marksAction(OpportunityStatus from, OpportunityStatus to) {
        return from.isOpen() && to != OpportunityStatus.VIEWED && to != OpportunityStatus.EXPIRED;
    }
}

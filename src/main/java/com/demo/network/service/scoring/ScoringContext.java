package com.demo.network.service.scoring;

import com.demo.network.model.Contact;
import com.demo.network.model.RelationshipGraph;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot a factor reads from: the contact, the account graph, every contact of the account
 * by id (for neighbor lookups) and the scoring instant. Factors never read the clock themselves.
 */
public record ScoringContext(
        Contact contact,
        RelationshipGraph graph,
        Map<String, Contact> contactsById,
        Instant asOf,
        List<String> userGoals
) {

    public ScoringContext {
        contactsById = contactsById == null ? Map.of() : contactsById;
        userGoals = userGoals == null ? List.of() : List.copyOf(userGoals);
    }

    /** Whole days between {@code at} and {@link #asOf()}, or -1 when {@code at} is null. */
    public long daysSince(Instant at) {
        if (at == null) return -1;
        return Duration.between(at, asOf).toDays();
    }
}

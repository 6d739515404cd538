package com.demo.network.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A person in the account's contact database. The three score fields, the flag set and
 * {@code lastScoredAt} are written only by the contact scorer.
 */
@Builder(toBuilder = true)
public record Contact(
        String id,
        String accountId,
        String firstName,
        String lastName,
        String email,
        String company,
        String position,
        String industry,
        String city,
        String state,
        String country,
        List<String> tags,
        String source,
        ContactTier tier,
        ContactStatus status,
        RelationshipType relationshipType,
        Instant connectionDate,
        Instant lastContactDate,
        Instant updatedAt,
        NetworkAnalytics analytics,
        EngagementStats engagement,
        Double priorityScore,
        Double opportunityScore,
        Double strategicValue,
        Set<OpportunityFlag> opportunityFlags,
        Instant lastScoredAt
) {

    public Contact {
        tags = tags == null ? List.of() : List.copyOf(tags);
        opportunityFlags = opportunityFlags == null ? Set.of() : Set.copyOf(opportunityFlags);
        engagement = engagement == null ? EngagementStats.EMPTY : engagement;
        status = status == null ? ContactStatus.ACTIVE : status;
    }

    public String displayName() {
        String first = firstName == null ? "" : firstName.trim();
        String last = lastName == null ? "" : lastName.trim();
        String name = (first + " " + last).trim();
        return name.isEmpty() ? id : name;
    }

    /** Lower-cased domain part of the email, or {@code null}. */
    public String emailDomain() {
        if (email == null) return null;
        int at = email.lastIndexOf('@');
        if (at < 0 || at == email.length() - 1) return null;
        return email.substring(at + 1).trim().toLowerCase(Locale.ROOT);
    }

    public boolean isActive() {
        return status == ContactStatus.ACTIVE;
    }

    public double strategicValueOrZero() {
        return strategicValue == null ? 0.0 : strategicValue;
    }

    public double opportunityScoreOrZero() {
        return opportunityScore == null ? 0.0 : opportunityScore;
    }

    public double priorityScoreOrZero() {
        return priorityScore == null ? 0.0 : priorityScore;
    }
}

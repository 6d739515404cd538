package com.demo.network.model;

import com.demo.network.exception.ValidationException;
import lombok.Builder;

import java.time.Instant;

/**
 * One logical edge. A mutual edge is stored once with {@code mutual = true}; the reverse
 * direction is a derived view (see {@link RelationshipGraph}).
 */
@Builder(toBuilder = true)
public record Relationship(
        String id,
        String accountId,
        String contactId,
        String relatedContactId,
        RelationshipType type,
        double strength,
        String notes,
        boolean verified,
        boolean mutual,
        RelationshipSource source,
        Instant createdAt
) {

    public Relationship {
        ValidationException.requireUnit("strength", strength);
        if (contactId != null && contactId.equals(relatedContactId)) {
            throw new ValidationException("A relationship needs two different contacts");
        }
    }

    public boolean touches(String id) {
        return id.equals(contactId) || id.equals(relatedContactId);
    }

    public String otherEnd(String id) {
        return id.equals(contactId) ? relatedContactId : contactId;
    }
}

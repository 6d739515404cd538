package com.demo.network.repository;

import com.demo.network.model.Relationship;

import java.util.List;

public interface RelationshipRepository {

    /** Every edge touching the contact, in either direction. */
    List<Relationship> listEdges(String contactId);

    List<Relationship> listByAccount(String accountId);

    /** @throws com.demo.network.exception.ConflictException on a duplicate (contact, relatedContact, type) */
    Relationship create(Relationship edge);

    boolean existsBetween(String contactId, String otherContactId);
}

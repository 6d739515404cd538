package com.demo.network.support;

import com.demo.network.exception.ConflictException;
import com.demo.network.model.Relationship;
import com.demo.network.repository.RelationshipRepository;

import java.util.ArrayList;
import java.util.List;

public class InMemoryRelationshipRepository implements RelationshipRepository {

    private final List<Relationship> rows = new ArrayList<>();

    public InMemoryRelationshipRepository add(Relationship... edges) {
        for (Relationship r : edges) create(r);
        return this;
    }

    public List<Relationship> all() {
        return List.copyOf(rows);
    }

    @Override
    public List<Relationship> listEdges(String contactId) {
        return rows.stream().filter(r -> r.touches(contactId)).toList();
    }

    @Override
    public List<Relationship> listByAccount(String accountId) {
        return rows.stream().filter(r -> accountId.equals(r.accountId())).toList();
    }

    @Override
    public Relationship create(Relationship edge) {
        boolean duplicate = rows.stream().anyMatch(r -> r.contactId().equals(edge.contactId())
                && r.relatedContactId().equals(edge.relatedContactId())
                && r.type() == edge.type());
        if (duplicate) {
            throw new ConflictException("Relationship already exists");
        }
        rows.add(edge);
        return edge;
    }

    @Override
    public boolean existsBetween(String contactId, String otherContactId) {
        return rows.stream().anyMatch(r -> r.touches(contactId) && r.otherEnd(contactId).equals(otherContactId));
    }
}

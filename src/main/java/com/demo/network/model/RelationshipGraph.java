package com.demo.network.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only adjacency view over a snapshot of edges. Neighbor sets are undirected;
 * {@link #outgoing(String)} expands mutual edges into both directions.
 */
public final class RelationshipGraph {

    private final Map<String, List<Relationship>> byContact = new HashMap<>();

    private RelationshipGraph(Collection<Relationship> edges) {
        for (Relationship r : edges) {
            byContact.computeIfAbsent(r.contactId(), k -> new ArrayList<>()).add(r);
            byContact.computeIfAbsent(r.relatedContactId(), k -> new ArrayList<>()).add(r);
        }
    }

    public static RelationshipGraph of(Collection<Relationship> edges) {
        return new RelationshipGraph(edges);
    }

    public static RelationshipGraph empty() {
        return new RelationshipGraph(List.of());
    }

    public List<Relationship> edgesOf(String contactId) {
        return Collections.unmodifiableList(byContact.getOrDefault(contactId, List.of()));
    }

    public Set<String> neighbors(String contactId) {
        Set<String> out = new LinkedHashSet<>();
        for (Relationship r : edgesOf(contactId)) {
            out.add(r.otherEnd(contactId));
        }
        return out;
    }

    public int degree(String contactId) {
        return neighbors(contactId).size();
    }

    public boolean connected(String a, String b) {
        for (Relationship r : edgesOf(a)) {
            if (r.otherEnd(a).equals(b)) return true;
        }
        return false;
    }

    public int mutualCount(String a, String b) {
        Set<String> na = neighbors(a);
        Set<String> nb = neighbors(b);
        int n = 0;
        for (String id : na) {
            if (!id.equals(b) && nb.contains(id)) n++;
        }
        return n;
    }

    /** Directed edges leaving {@code contactId}; a mutual edge stored the other way round is included reversed. */
    public List<Relationship> outgoing(String contactId) {
        List<Relationship> out = new ArrayList<>();
        for (Relationship r : edgesOf(contactId)) {
            if (r.contactId().equals(contactId)) {
                out.add(r);
            } else if (r.mutual()) {
                out.add(r.toBuilder()
                        .contactId(contactId)
                        .relatedContactId(r.contactId())
                        .build());
            }
        }
        return out;
    }
}

package com.demo.network.support;

import com.demo.network.exception.NotFoundException;
import com.demo.network.model.Contact;
import com.demo.network.repository.ContactFilter;
import com.demo.network.repository.ContactRepository;
import com.demo.network.repository.ContactScorePatch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryContactRepository implements ContactRepository {

    private final Map<String, Contact> rows = new LinkedHashMap<>();
    private int updates;

    public InMemoryContactRepository add(Contact... contacts) {
        for (Contact c : contacts) rows.put(c.id(), c);
        return this;
    }

    public int updates() {
        return updates;
    }

    @Override
    public List<Contact> list(String accountId, ContactFilter filter) {
        List<Contact> out = new ArrayList<>();
        for (Contact c : rows.values()) {
            if (!accountId.equals(c.accountId())) continue;
            if (filter.status() != null && c.status() != filter.status()) continue;
            if (filter.ids() != null && !filter.ids().contains(c.id())) continue;
            out.add(c);
        }
        return out;
    }

    @Override
    public Optional<Contact> get(String id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public void update(String id, ContactScorePatch patch) {
        Contact c = rows.get(id);
        if (c == null) throw NotFoundException.of("Contact", id);
        rows.put(id, c.toBuilder()
                .priorityScore(patch.priorityScore())
                .opportunityScore(patch.opportunityScore())
                .strategicValue(patch.strategicValue())
                .opportunityFlags(patch.flags())
                .lastScoredAt(patch.scoredAt())
                .build());
        updates++;
    }
}

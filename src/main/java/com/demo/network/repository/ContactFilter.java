package com.demo.network.repository;

import com.demo.network.model.ContactStatus;

import java.util.Collection;
import java.util.Set;

/** Narrowing options for {@link ContactRepository#list}. A null field means "any". */
public record ContactFilter(ContactStatus status, Set<String> ids) {

    public static ContactFilter active() {
        return new ContactFilter(ContactStatus.ACTIVE, null);
    }

    public static ContactFilter activeIn(Collection<String> ids) {
        return new ContactFilter(ContactStatus.ACTIVE, ids == null ? null : Set.copyOf(ids));
    }

    public static ContactFilter all() {
        return new ContactFilter(null, null);
    }
}

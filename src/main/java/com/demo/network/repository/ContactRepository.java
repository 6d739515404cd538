package com.demo.network.repository;

import com.demo.network.model.Contact;

import java.util.List;
import java.util.Optional;

public interface ContactRepository {

    List<Contact> list(String accountId, ContactFilter filter);

    Optional<Contact> get(String id);

    /** @throws com.demo.network.exception.NotFoundException when no contact has this id */
    void update(String id, ContactScorePatch patch);
}

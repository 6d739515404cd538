package com.demo.network.service.discovery;

import com.demo.network.model.Contact;
import com.demo.network.model.RelationshipGraph;
import com.demo.network.service.evidence.ContactText;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decides which partners each contact is compared with. Every unordered pair is visited
 * once, from the contact with the smaller id.
 */
abstract class PairPlan {

    abstract List<Contact> partnersOf(Contact source);

    /** All pairs; contacts must be sorted by id. */
    static PairPlan fullScan(List<Contact> sortedContacts) {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < sortedContacts.size(); i++) {
            position.put(sortedContacts.get(i).id(), i);
        }
        return new PairPlan() {
            @Override
            List<Contact> partnersOf(Contact source) {
                int i = position.get(source.id());
                return sortedContacts.subList(i + 1, sortedContacts.size());
            }
        };
    }

    /**
     * Only pairs that share a normalized company, a non-free email domain, or a neighbor
     * in the graph. Used above the full-scan limit so cost grows with edges found.
     */
    static PairPlan blocked(List<Contact> contacts, RelationshipGraph graph) {
        Map<String, List<Contact>> blocks = new HashMap<>();
        Map<String, Contact> byId = new HashMap<>();
        for (Contact c : contacts) {
            byId.put(c.id(), c);
            for (String key : blockingKeys(c)) {
                blocks.computeIfAbsent(key, k -> new ArrayList<>()).add(c);
            }
        }
        return new PairPlan() {
            @Override
            List<Contact> partnersOf(Contact source) {
                Map<String, Contact> partners = new TreeMap<>();
                for (String key : blockingKeys(source)) {
                    for (Contact other : blocks.getOrDefault(key, List.of())) {
                        if (other.id().compareTo(source.id()) > 0) partners.put(other.id(), other);
                    }
                }
                for (String neighbor : graph.neighbors(source.id())) {
                    for (String twoHop : graph.neighbors(neighbor)) {
                        Contact other = byId.get(twoHop);
                        if (other != null && twoHop.compareTo(source.id()) > 0) partners.put(twoHop, other);
                    }
                }
                return new ArrayList<>(partners.values());
            }
        };
    }

    static List<String> blockingKeys(Contact c) {
        List<String> keys = new ArrayList<>(2);
        String company = ContactText.normalizeCompany(c.company());
        if (company != null) keys.add("company:" + company);
        String domain = c.emailDomain();
        if (domain != null && !ContactText.isFreeEmailDomain(domain)) keys.add("domain:" + domain);
        return keys;
    }
}

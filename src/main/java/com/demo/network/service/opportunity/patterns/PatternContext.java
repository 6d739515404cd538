package com.demo.network.service.opportunity.patterns;

import com.demo.network.config.NetworkProperties;
import com.demo.network.model.Contact;
import com.demo.network.model.ContactTier;
import com.demo.network.model.RelationshipGraph;
import com.demo.network.service.evidence.ContactText;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Read-only snapshot of one account handed to every pattern. */
public record PatternContext(
        String accountId,
        List<Contact> activeContacts,
        Map<String, Contact> contactsById,
        RelationshipGraph graph,
        Instant asOf,
        NetworkProperties.Opportunity settings
) {

    /** Days since the last touch, falling back to the connection date; -1 when neither is known. */
    public long dormantDays(Contact c) {
        Instant last = c.lastContactDate() != null ? c.lastContactDate() : c.connectionDate();
        return last == null ? -1 : Duration.between(last, asOf).toDays();
    }

    /** Touched within the reconnection window. */
    public boolean isWarm(Contact c) {
        long days = dormantDays(c);
        return days >= 0 && days <= settings.getReconnectionDays();
    }

    /** Configured keywords plus the industries of the user's TIER_1 contacts, normalized. */
    public Set<String> interests() {
        Set<String> out = new LinkedHashSet<>();
        for (String k : settings.getInterestKeywords()) {
            String n = ContactText.normalize(k);
            if (n != null) out.add(n);
        }
        for (Contact c : activeContacts) {
            if (c.tier() == ContactTier.TIER_1) {
                String industry = ContactText.normalize(c.industry());
                if (industry != null) out.add(industry);
            }
        }
        return out;
    }

    /** First interest found in the contact's company, position or industry, or {@code null}. */
    public String matchedInterest(Contact c, Set<String> interests) {
        String text = String.join(" ",
                nullToEmpty(c.company()), nullToEmpty(c.position()), nullToEmpty(c.industry()));
        for (String interest : interests) {
            if (ContactText.containsWord(text, interest)) return interest;
        }
        return null;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}

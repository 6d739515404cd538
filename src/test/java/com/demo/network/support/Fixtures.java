package com.demo.network.support;

import com.demo.network.config.NetworkProperties;
import com.demo.network.model.Contact;
import com.demo.network.model.ContactStatus;
import com.demo.network.model.OpportunityCategory;
import com.demo.network.model.OpportunityPriority;
import com.demo.network.model.OpportunityStatus;
import com.demo.network.model.OpportunitySuggestion;
import com.demo.network.model.OpportunityType;
import com.demo.network.model.Relationship;
import com.demo.network.model.RelationshipSource;
import com.demo.network.model.RelationshipType;
import com.demo.network.service.batch.ChunkedBatchRunner;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/** Shared builders for service tests. Everything runs against {@link #NOW}. */
public final class Fixtures {

    public static final String ACCOUNT = "acct-1";
    public static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private Fixtures() {
    }

    public static Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static ChunkedBatchRunner runner() {
        return new ChunkedBatchRunner(TransactionOperations.withoutTransaction(), clock());
    }

    public static Instant daysAgo(long days) {
        return NOW.minus(Duration.ofDays(days));
    }

    public static Contact.ContactBuilder contact(String id) {
        return Contact.builder()
                .id(id)
                .accountId(ACCOUNT)
                .firstName(id.toUpperCase())
                .lastName("Test")
                .status(ContactStatus.ACTIVE);
    }

    public static Relationship edge(String from, String to, double strength) {
        return Relationship.builder()
                .id(from + "-" + to)
                .accountId(ACCOUNT)
                .contactId(from)
                .relatedContactId(to)
                .type(RelationshipType.COLLEAGUE)
                .strength(strength)
                .verified(true)
                .source(RelationshipSource.MANUAL)
                .createdAt(daysAgo(100))
                .build();
    }

    public static OpportunitySuggestion.OpportunitySuggestionBuilder suggestion(String id) {
        return OpportunitySuggestion.builder()
                .id(id)
                .accountId(ACCOUNT)
                .category(OpportunityCategory.RECONNECTION)
                .type(OpportunityType.DORMANT_RECONNECTION)
                .title("Reconnect with " + id)
                .description("Quiet for a while")
                .confidenceScore(0.8)
                .impactScore(80)
                .urgencyScore(60)
                .priority(OpportunityPriority.HIGH)
                .status(OpportunityStatus.PENDING)
                .primaryContactId("c-" + id)
                .dedupeKey("RECONNECTION|c-" + id + "|direct")
                .createdAt(daysAgo(1));
    }

    public static NetworkProperties properties() {
        return new NetworkProperties();
    }
}

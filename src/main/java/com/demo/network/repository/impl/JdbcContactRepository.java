package com.demo.network.repository.impl;

import com.demo.network.exception.NotFoundException;
import com.demo.network.model.Contact;
import com.demo.network.model.ContactStatus;
import com.demo.network.model.ContactTier;
import com.demo.network.model.EngagementStats;
import com.demo.network.model.NetworkAnalytics;
import com.demo.network.model.OpportunityFlag;
import com.demo.network.model.RelationshipType;
import com.demo.network.repository.ContactFilter;
import com.demo.network.repository.ContactRepository;
import com.demo.network.repository.ContactScorePatch;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.demo.network.repository.impl.RowSupport.enumOrNull;
import static com.demo.network.repository.impl.RowSupport.instant;
import static com.demo.network.repository.impl.RowSupport.nullableDouble;
import static com.demo.network.repository.impl.RowSupport.nullableInt;
import static com.demo.network.repository.impl.RowSupport.ts;

@Repository
@RequiredArgsConstructor
public class JdbcContactRepository implements ContactRepository {

    private static final TypeReference<List<String>> TAGS = new TypeReference<>() {};
    private static final TypeReference<Set<OpportunityFlag>> FLAGS = new TypeReference<>() {};

    private static final String COLUMNS = """
            id, account_id, first_name, last_name, email, company, position_title, industry,
            city, state_region, country, tags, source, tier, status, relationship_type,
            connection_date, last_contact_date, updated_at,
            influence_score, total_connections, betweenness_centrality,
            outreach_count, responded_count, campaign_count, campaign_responded,
            priority_score, opportunity_score, strategic_value, opportunity_flags, last_scored_at
            """;

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    @Override
    public List<Contact> list(String accountId, ContactFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM contacts WHERE account_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(accountId);
        if (filter != null && filter.status() != null) {
            sql.append(" AND status = ?");
            args.add(filter.status().name());
        }
        if (filter != null && filter.ids() != null) {
            if (filter.ids().isEmpty()) return List.of();
            sql.append(" AND id IN (").append(String.join(",", Collections.nCopies(filter.ids().size(), "?"))).append(")");
            args.addAll(filter.ids());
        }
        sql.append(" ORDER BY id");
        return jdbc.query(sql.toString(), rm(), args.toArray());
    }

    @Override
    public Optional<Contact> get(String id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM contacts WHERE id = ?", rm(), id).stream().findFirst();
    }

    @Override
    public void update(String id, ContactScorePatch patch) {
        String sql = """
            UPDATE contacts
               SET priority_score = ?, opportunity_score = ?, strategic_value = ?,
                   opportunity_flags = ?, last_scored_at = ?
             WHERE id = ?
        """;
        int n = jdbc.update(sql,
                patch.priorityScore(), patch.opportunityScore(), patch.strategicValue(),
                RowSupport.toJson(objectMapper, patch.flags()), ts(patch.scoredAt()), id);
        if (n == 0) {
            throw NotFoundException.of("Contact", id);
        }
    }

    /** Inserts a contact row. Contacts are owned by the contact-management layer; used for seeding and tests. */
    public void insert(Contact c) {
        String sql = "INSERT INTO contacts (" + COLUMNS + ") VALUES ("
                + String.join(",", Collections.nCopies(31, "?")) + ")";
        NetworkAnalytics a = c.analytics();
        EngagementStats e = c.engagement();
        jdbc.update(sql,
                c.id(), c.accountId(), c.firstName(), c.lastName(), c.email(), c.company(), c.position(), c.industry(),
                c.city(), c.state(), c.country(), RowSupport.toJson(objectMapper, c.tags()), c.source(),
                RowSupport.name(c.tier()), c.status().name(), RowSupport.name(c.relationshipType()),
                ts(c.connectionDate()), ts(c.lastContactDate()), ts(c.updatedAt()),
                a == null ? null : a.influenceScore(), a == null ? null : a.totalConnections(),
                a == null ? null : a.betweennessCentrality(),
                e.outreachCount(), e.respondedCount(), e.campaignCount(), e.campaignResponded(),
                c.priorityScore(), c.opportunityScore(), c.strategicValue(),
                RowSupport.toJson(objectMapper, c.opportunityFlags()), ts(c.lastScoredAt()));
    }

    private RowMapper<Contact> rm() {
        return (rs, i) -> {
            Double influence = nullableDouble(rs, "influence_score");
            NetworkAnalytics analytics = influence == null ? null : new NetworkAnalytics(
                    influence,
                    Optional.ofNullable(nullableInt(rs, "total_connections")).orElse(0),
                    Optional.ofNullable(nullableDouble(rs, "betweenness_centrality")).orElse(0.0));
            return Contact.builder()
                    .id(rs.getString("id"))
                    .accountId(rs.getString("account_id"))
                    .firstName(rs.getString("first_name"))
                    .lastName(rs.getString("last_name"))
                    .email(rs.getString("email"))
                    .company(rs.getString("company"))
                    .position(rs.getString("position_title"))
                    .industry(rs.getString("industry"))
                    .city(rs.getString("city"))
                    .state(rs.getString("state_region"))
                    .country(rs.getString("country"))
                    .tags(RowSupport.fromJson(objectMapper, rs.getString("tags"), TAGS, List.of()))
                    .source(rs.getString("source"))
                    .tier(enumOrNull(ContactTier.class, rs.getString("tier")))
                    .status(ContactStatus.valueOf(rs.getString("status")))
                    .relationshipType(enumOrNull(RelationshipType.class, rs.getString("relationship_type")))
                    .connectionDate(instant(rs, "connection_date"))
                    .lastContactDate(instant(rs, "last_contact_date"))
                    .updatedAt(instant(rs, "updated_at"))
                    .analytics(analytics)
                    .engagement(new EngagementStats(
                            rs.getInt("outreach_count"), rs.getInt("responded_count"),
                            rs.getInt("campaign_count"), rs.getInt("campaign_responded")))
                    .priorityScore(nullableDouble(rs, "priority_score"))
                    .opportunityScore(nullableDouble(rs, "opportunity_score"))
                    .strategicValue(nullableDouble(rs, "strategic_value"))
                    .opportunityFlags(RowSupport.fromJson(objectMapper, rs.getString("opportunity_flags"), FLAGS, Set.of()))
                    .lastScoredAt(instant(rs, "last_scored_at"))
                    .build();
        };
    }
}

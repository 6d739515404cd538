package com.demo.network.repository.impl;

import com.demo.network.model.ActualOutcome;
import com.demo.network.model.OpportunityCategory;
import com.demo.network.model.OpportunityPriority;
import com.demo.network.model.OpportunityStatus;
import com.demo.network.model.OpportunitySuggestion;
import com.demo.network.model.OpportunityType;
import com.demo.network.model.OutcomeMetadata;
import com.demo.network.repository.OpportunityRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.demo.network.repository.impl.RowSupport.enumOrNull;
import static com.demo.network.repository.impl.RowSupport.instant;
import static com.demo.network.repository.impl.RowSupport.nullableDouble;
import static com.demo.network.repository.impl.RowSupport.nullableInt;
import static com.demo.network.repository.impl.RowSupport.ts;

@Repository
@RequiredArgsConstructor
public class JdbcOpportunityRepository implements OpportunityRepository {

    private static final TypeReference<List<String>> FACTORS = new TypeReference<>() {};

    private static final String COLUMNS = """
            id, account_id, category, opportunity_type, title, description,
            confidence_score, impact_score, urgency_score, priority, status,
            primary_contact_id, secondary_contact_id, dedupe_key, evidence_factors,
            created_at, expires_at, acted_at, completed_at,
            actual_outcome, user_rating, actual_impact, outcome_success
            """;

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    @Override
    public OpportunitySuggestion create(OpportunitySuggestion s) {
        String sql = "INSERT INTO opportunity_suggestions (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
        OutcomeMetadata o = s.outcome();
        jdbc.update(sql,
                s.id(), s.accountId(), s.category().name(), s.type().name(), s.title(), s.description(),
                s.confidenceScore(), s.impactScore(), s.urgencyScore(), s.priority().name(), s.status().name(),
                s.primaryContactId(), s.secondaryContactId(), s.dedupeKey(),
                RowSupport.toJson(objectMapper, s.evidenceFactors()),
                ts(s.createdAt()), ts(s.expiresAt()), ts(s.actedAt()), ts(s.completedAt()),
                o == null ? null : RowSupport.name(o.actualOutcome()),
                o == null ? null : o.rating(),
                o == null ? null : o.actualImpact(),
                o == null ? null : o.success());
        return s;
    }

    @Override
    public Optional<OpportunitySuggestion> findById(String id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM opportunity_suggestions WHERE id = ?", rm(), id)
                .stream().findFirst();
    }

    @Override
    public List<OpportunitySuggestion> listPending(String accountId, Instant now) {
        String sql = "SELECT " + COLUMNS + """
             FROM opportunity_suggestions
            WHERE account_id = ? AND status IN ('PENDING', 'VIEWED')
              AND (expires_at IS NULL OR expires_at > ?)
            ORDER BY created_at, id
        """;
        return jdbc.query(sql, rm(), accountId, ts(now));
    }

    @Override
    public List<OpportunitySuggestion> listCreatedSince(String accountId, Instant since) {
        String sql = "SELECT " + COLUMNS
                + " FROM opportunity_suggestions WHERE account_id = ? AND created_at >= ? ORDER BY created_at, id";
        return jdbc.query(sql, rm(), accountId, ts(since));
    }

    @Override
    public List<OpportunitySuggestion> listOverdue(String accountId, Instant now) {
        String sql = "SELECT " + COLUMNS + """
             FROM opportunity_suggestions
            WHERE account_id = ? AND status IN ('PENDING', 'VIEWED')
              AND expires_at IS NOT NULL AND expires_at <= ?
            ORDER BY expires_at, id
        """;
        return jdbc.query(sql, rm(), accountId, ts(now));
    }

    @Override
    public Optional<OpportunitySuggestion> findOpenByDedupeKey(String accountId, String dedupeKey) {
        String sql = "SELECT " + COLUMNS + """
             FROM opportunity_suggestions
            WHERE account_id = ? AND dedupe_key = ?
              AND status NOT IN ('COMPLETED', 'REJECTED', 'EXPIRED')
            ORDER BY created_at DESC
        """;
        return jdbc.query(sql, rm(), accountId, dedupeKey).stream().findFirst();
    }

    @Override
    public boolean updateStatus(String id, OpportunityStatus expected, OpportunityStatus next,
                                Instant actedAt, Instant completedAt) {
        StringBuilder sql = new StringBuilder("UPDATE opportunity_suggestions SET status = ?");
        List<Object> args = new ArrayList<>();
        args.add(next.name());
        if (actedAt != null) {
            sql.append(", acted_at = ?");
            args.add(ts(actedAt));
        }
        if (completedAt != null) {
            sql.append(", completed_at = ?");
            args.add(ts(completedAt));
        }
        sql.append(" WHERE id = ? AND status = ?");
        args.add(id);
        args.add(expected.name());
        return jdbc.update(sql.toString(), args.toArray()) == 1;
    }

    @Override
    public void recordOutcome(String id, OutcomeMetadata outcome) {
        String sql = """
            UPDATE opportunity_suggestions
               SET actual_outcome = ?, user_rating = ?, actual_impact = ?, outcome_success = ?
             WHERE id = ?
        """;
        jdbc.update(sql, outcome.actualOutcome().name(), outcome.rating(), outcome.actualImpact(),
                outcome.success(), id);
    }

    private RowMapper<OpportunitySuggestion> rm() {
        return (rs, i) -> {
            String outcome = rs.getString("actual_outcome");
            OutcomeMetadata meta = outcome == null ? null : new OutcomeMetadata(
                    ActualOutcome.valueOf(outcome),
                    Optional.ofNullable(nullableInt(rs, "user_rating")).orElse(0),
                    Optional.ofNullable(nullableDouble(rs, "actual_impact")).orElse(0.0),
                    rs.getBoolean("outcome_success"));
            return OpportunitySuggestion.builder()
                    .id(rs.getString("id"))
                    .accountId(rs.getString("account_id"))
                    .category(OpportunityCategory.valueOf(rs.getString("category")))
                    .type(OpportunityType.valueOf(rs.getString("opportunity_type")))
                    .title(rs.getString("title"))
                    .description(rs.getString("description"))
                    .confidenceScore(rs.getDouble("confidence_score"))
                    .impactScore(rs.getDouble("impact_score"))
                    .urgencyScore(rs.getDouble("urgency_score"))
                    .priority(OpportunityPriority.valueOf(rs.getString("priority")))
                    .status(enumOrNull(OpportunityStatus.class, rs.getString("status")))
                    .primaryContactId(rs.getString("primary_contact_id"))
                    .secondaryContactId(rs.getString("secondary_contact_id"))
                    .dedupeKey(rs.getString("dedupe_key"))
                    .evidenceFactors(RowSupport.fromJson(objectMapper, rs.getString("evidence_factors"), FACTORS, List.of()))
                    .createdAt(instant(rs, "created_at"))
                    .expiresAt(instant(rs, "expires_at"))
                    .actedAt(instant(rs, "acted_at"))
                    .completedAt(instant(rs, "completed_at"))
                    .outcome(meta)
                    .build();
        };
    }
}

package com.demo.network.repository.impl;

import com.demo.network.model.CandidateStatus;
import com.demo.network.model.EvidenceSignal;
import com.demo.network.model.PotentialRelationship;
import com.demo.network.model.RelationshipType;
import com.demo.network.repository.CandidateRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.demo.network.repository.impl.RowSupport.instant;
import static com.demo.network.repository.impl.RowSupport.ts;

@Repository
@RequiredArgsConstructor
public class JdbcCandidateRepository implements CandidateRepository {

    private static final TypeReference<List<EvidenceSignal>> EVIDENCE = new TypeReference<>() {};

    private static final String COLUMNS = """
            id, account_id, contact_id, related_contact_id, inferred_type, confidence,
            evidence, fingerprint, status, created_at, reviewed_at
            """;

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    /** Most recent row for the fingerprint; older rows are history. */
    @Override
    public Optional<PotentialRelationship> findCandidate(String fingerprint) {
        String sql = "SELECT " + COLUMNS + " FROM relationship_candidates WHERE fingerprint = ? ORDER BY created_at DESC, id DESC";
        return jdbc.query(sql, rm(), fingerprint).stream().findFirst();
    }

    @Override
    public Optional<PotentialRelationship> findById(String id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM relationship_candidates WHERE id = ?", rm(), id)
                .stream().findFirst();
    }

    @Override
    public Optional<PotentialRelationship> findPendingForPair(String contactId, String otherContactId) {
        String sql = "SELECT " + COLUMNS + """
             FROM relationship_candidates
            WHERE status = 'PENDING'
              AND ((contact_id = ? AND related_contact_id = ?) OR (contact_id = ? AND related_contact_id = ?))
            ORDER BY created_at DESC
        """;
        return jdbc.query(sql, rm(), contactId, otherContactId, otherContactId, contactId).stream().findFirst();
    }

    @Override
    public List<PotentialRelationship> listPending(String accountId) {
        String sql = "SELECT " + COLUMNS
                + " FROM relationship_candidates WHERE account_id = ? AND status = 'PENDING' ORDER BY confidence DESC, id";
        return jdbc.query(sql, rm(), accountId);
    }

    @Override
    public PotentialRelationship create(PotentialRelationship c) {
        String sql = "INSERT INTO relationship_candidates (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)";
        jdbc.update(sql,
                c.id(), c.accountId(), c.contactId(), c.relatedContactId(), c.inferredType().name(), c.confidence(),
                RowSupport.toJson(objectMapper, c.evidence()), c.fingerprint(), c.status().name(),
                ts(c.createdAt()), ts(c.reviewedAt()));
        return c;
    }

    @Override
    public void refresh(PotentialRelationship c) {
        String sql = """
            UPDATE relationship_candidates
               SET inferred_type = ?, confidence = ?, evidence = ?, fingerprint = ?
             WHERE id = ? AND status = 'PENDING'
        """;
        jdbc.update(sql, c.inferredType().name(), c.confidence(),
                RowSupport.toJson(objectMapper, c.evidence()), c.fingerprint(), c.id());
    }

    @Override
    public boolean updateStatus(String id, CandidateStatus expected, CandidateStatus next, Instant reviewedAt) {
        String sql = "UPDATE relationship_candidates SET status = ?, reviewed_at = ? WHERE id = ? AND status = ?";
        return jdbc.update(sql, next.name(), ts(reviewedAt), id, expected.name()) == 1;
    }

    private RowMapper<PotentialRelationship> rm() {
        return (rs, i) -> PotentialRelationship.builder()
                .id(rs.getString("id"))
                .accountId(rs.getString("account_id"))
                .contactId(rs.getString("contact_id"))
                .relatedContactId(rs.getString("related_contact_id"))
                .inferredType(RelationshipType.valueOf(rs.getString("inferred_type")))
                .confidence(rs.getDouble("confidence"))
                .evidence(RowSupport.fromJson(objectMapper, rs.getString("evidence"), EVIDENCE, List.of()))
                .fingerprint(rs.getString("fingerprint"))
                .status(CandidateStatus.valueOf(rs.getString("status")))
                .createdAt(instant(rs, "created_at"))
                .reviewedAt(instant(rs, "reviewed_at"))
                .build();
    }
}

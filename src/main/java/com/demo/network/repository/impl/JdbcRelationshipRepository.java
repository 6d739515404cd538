package com.demo.network.repository.impl;

import com.demo.network.exception.ConflictException;
import com.demo.network.model.Relationship;
import com.demo.network.model.RelationshipSource;
import com.demo.network.model.RelationshipType;
import com.demo.network.repository.RelationshipRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.demo.network.repository.impl.RowSupport.instant;
import static com.demo.network.repository.impl.RowSupport.ts;

@Repository
@RequiredArgsConstructor
public class JdbcRelationshipRepository implements RelationshipRepository {

    private static final String COLUMNS = """
            id, account_id, contact_id, related_contact_id, relationship_type, strength,
            notes, verified, mutual, source, created_at
            """;

    private final JdbcTemplate jdbc;

    @Override
    public List<Relationship> listEdges(String contactId) {
        String sql = "SELECT " + COLUMNS + " FROM relationships WHERE contact_id = ? OR related_contact_id = ? ORDER BY created_at, id";
        return jdbc.query(sql, rm(), contactId, contactId);
    }

    @Override
    public List<Relationship> listByAccount(String accountId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM relationships WHERE account_id = ? ORDER BY id", rm(), accountId);
    }

    @Override
    public Relationship create(Relationship edge) {
        String sql = "INSERT INTO relationships (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)";
        try {
            jdbc.update(sql,
                    edge.id(), edge.accountId(), edge.contactId(), edge.relatedContactId(), edge.type().name(),
                    edge.strength(), edge.notes(), edge.verified(), edge.mutual(),
                    edge.source() == null ? RelationshipSource.MANUAL.name() : edge.source().name(),
                    ts(edge.createdAt()));
        } catch (DuplicateKeyException ex) {
            throw new ConflictException("A " + edge.type() + " relationship from " + edge.contactId()
                    + " to " + edge.relatedContactId() + " already exists", ex);
        }
        return edge;
    }

    @Override
    public boolean existsBetween(String contactId, String otherContactId) {
        String sql = """
            SELECT COUNT(*) FROM relationships
             WHERE (contact_id = ? AND related_contact_id = ?)
                OR (contact_id = ? AND related_contact_id = ?)
        """;
        Integer n = jdbc.queryForObject(sql, Integer.class, contactId, otherContactId, otherContactId, contactId);
        return n != null && n > 0;
    }

    private RowMapper<Relationship> rm() {
        return (rs, i) -> Relationship.builder()
                .id(rs.getString("id"))
                .accountId(rs.getString("account_id"))
                .contactId(rs.getString("contact_id"))
                .relatedContactId(rs.getString("related_contact_id"))
                .type(RelationshipType.valueOf(rs.getString("relationship_type")))
                .strength(rs.getDouble("strength"))
                .notes(rs.getString("notes"))
                .verified(rs.getBoolean("verified"))
                .mutual(rs.getBoolean("mutual"))
                .source(RelationshipSource.valueOf(rs.getString("source")))
                .createdAt(instant(rs, "created_at"))
                .build();
    }
}

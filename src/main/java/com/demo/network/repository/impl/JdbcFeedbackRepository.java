package com.demo.network.repository.impl;

import com.demo.network.exception.ConflictException;
import com.demo.network.model.ActualOutcome;
import com.demo.network.model.OpportunityFeedback;
import com.demo.network.repository.FeedbackRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

import static com.demo.network.repository.impl.RowSupport.instant;
import static com.demo.network.repository.impl.RowSupport.ts;

@Repository
@RequiredArgsConstructor
public class JdbcFeedbackRepository implements FeedbackRepository {

    private static final String COLUMNS = """
            opportunity_id, user_id, rating, actual_outcome, actual_impact,
            time_invested_hours, free_text, success, created_at
            """;

    private final JdbcTemplate jdbc;

    @Override
    public void insert(OpportunityFeedback f) {
        try {
            jdbc.update("INSERT INTO opportunity_feedback (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)",
                    f.opportunityId(), f.userId(), f.rating(), f.actualOutcome().name(), f.actualImpact(),
                    f.timeInvestedHours(), f.freeText(), f.success(), ts(f.createdAt()));
        } catch (DuplicateKeyException ex) {
            throw new ConflictException("Feedback already recorded for opportunity " + f.opportunityId(), ex);
        }
    }

    @Override
    public Optional<OpportunityFeedback> findByOpportunity(String opportunityId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM opportunity_feedback WHERE opportunity_id = ?", rm(), opportunityId)
                .stream().findFirst();
    }

    private RowMapper<OpportunityFeedback> rm() {
        return (rs, i) -> OpportunityFeedback.builder()
                .opportunityId(rs.getString("opportunity_id"))
                .userId(rs.getString("user_id"))
                .rating(rs.getInt("rating"))
                .actualOutcome(ActualOutcome.valueOf(rs.getString("actual_outcome")))
                .actualImpact(rs.getDouble("actual_impact"))
                .timeInvestedHours(rs.getDouble("time_invested_hours"))
                .freeText(rs.getString("free_text"))
                .success(rs.getBoolean("success"))
                .createdAt(instant(rs, "created_at"))
                .build();
    }
}

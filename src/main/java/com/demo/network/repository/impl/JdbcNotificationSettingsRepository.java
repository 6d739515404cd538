package com.demo.network.repository.impl;

import com.demo.network.model.NotificationSettings;
import com.demo.network.model.OpportunityCategory;
import com.demo.network.repository.NotificationSettingsRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
public class JdbcNotificationSettingsRepository implements NotificationSettingsRepository {

    private static final String COLUMNS = """
            user_id, account_id, enabled_categories, min_confidence, min_impact,
            daily_digest, real_time_alerts, urgent_only
            """;

    private final JdbcTemplate jdbc;

    @Override
    public List<NotificationSettings> listForAccount(String accountId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM notification_settings WHERE account_id = ? ORDER BY user_id",
                rm(), accountId);
    }

    @Override
    public Optional<NotificationSettings> find(String userId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM notification_settings WHERE user_id = ?", rm(), userId)
                .stream().findFirst();
    }

    @Override
    public void save(NotificationSettings s) {
        String categories = s.enabledCategories().stream()
                .map(Enum::name).sorted().collect(Collectors.joining(","));
        int n = jdbc.update("""
            UPDATE notification_settings
               SET account_id = ?, enabled_categories = ?, min_confidence = ?, min_impact = ?,
                   daily_digest = ?, real_time_alerts = ?, urgent_only = ?
             WHERE user_id = ?
        """, s.accountId(), categories, s.minConfidence(), s.minImpact(),
                s.dailyDigest(), s.realTimeAlerts(), s.urgentOnly(), s.userId());
        if (n == 0) {
            jdbc.update("INSERT INTO notification_settings (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)",
                    s.userId(), s.accountId(), categories, s.minConfidence(), s.minImpact(),
                    s.dailyDigest(), s.realTimeAlerts(), s.urgentOnly());
        }
    }

    private RowMapper<NotificationSettings> rm() {
        return (rs, i) -> NotificationSettings.builder()
                .userId(rs.getString("user_id"))
                .accountId(rs.getString("account_id"))
                .enabledCategories(parse(rs.getString("enabled_categories")))
                .minConfidence(rs.getDouble("min_confidence"))
                .minImpact(rs.getDouble("min_impact"))
                .dailyDigest(rs.getBoolean("daily_digest"))
                .realTimeAlerts(rs.getBoolean("real_time_alerts"))
                .urgentOnly(rs.getBoolean("urgent_only"))
                .build();
    }

    private static Set<OpportunityCategory> parse(String csv) {
        Set<OpportunityCategory> out = EnumSet.noneOf(OpportunityCategory.class);
        if (csv == null || csv.isBlank()) return out;
        Arrays.stream(csv.split(","))
                .map(String::trim).filter(s -> !s.isEmpty())
                .map(OpportunityCategory::valueOf)
                .forEach(out::add);
        return out;
    }
}

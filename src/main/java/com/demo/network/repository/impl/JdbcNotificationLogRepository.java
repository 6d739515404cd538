package com.demo.network.repository.impl;

import com.demo.network.repository.NotificationLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
@RequiredArgsConstructor
public class JdbcNotificationLogRepository implements NotificationLogRepository {

    private final JdbcTemplate jdbc;

    @Override
    public boolean wasSent(String userId, String deliveryKey) {
        Integer n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM notification_log WHERE user_id = ? AND delivery_key = ?",
                Integer.class, userId, deliveryKey);
        return n != null && n > 0;
    }

    @Override
    public boolean markSent(String userId, String deliveryKey, Instant sentAt) {
        try {
            jdbc.update("INSERT INTO notification_log (user_id, delivery_key, sent_at) VALUES (?,?,?)",
                    userId, deliveryKey, RowSupport.ts(sentAt));
            return true;
        } catch (DuplicateKeyException ex) {
            return false;
        }
    }
}

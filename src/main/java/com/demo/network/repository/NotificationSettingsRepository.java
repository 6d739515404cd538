package com.demo.network.repository;

import com.demo.network.model.NotificationSettings;

import java.util.List;
import java.util.Optional;

public interface NotificationSettingsRepository {

    List<NotificationSettings> listForAccount(String accountId);

    Optional<NotificationSettings> find(String userId);

    void save(NotificationSettings settings);
}

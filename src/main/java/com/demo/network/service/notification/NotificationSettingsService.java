package com.demo.network.service.notification;

import com.demo.network.exception.ValidationException;
import com.demo.network.model.NotificationSettings;
import com.demo.network.repository.NotificationSettingsRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class NotificationSettingsService {

    private final NotificationSettingsRepository repository;

    public NotificationSettingsService(NotificationSettingsRepository repository) {
        this.repository = repository;
    }

    /** Stored settings, or the defaults when the user never saved any. */
    public NotificationSettings get(String userId, String accountId) {
        return repository.find(userId).orElseGet(() -> NotificationSettings.defaults(userId, accountId));
    }

    public List<NotificationSettings> listForAccount(String accountId) {
        return repository.listForAccount(accountId);
    }

    public NotificationSettings save(NotificationSettings settings) {
        if (settings.userId() == null || settings.userId().isBlank()) {
            throw new ValidationException("userId is required");
        }
        if (settings.accountId() == null || settings.accountId().isBlank()) {
            throw new ValidationException("accountId is required");
        }
        ValidationException.requireUnit("minConfidence", settings.minConfidence());
        ValidationException.requirePercent("minImpact", settings.minImpact());
        repository.save(settings);
        return settings;
    }
}

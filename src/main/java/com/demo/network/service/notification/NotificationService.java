package com.demo.network.service.notification;

import com.demo.network.config.NetworkProperties;
import com.demo.network.model.NotificationSettings;
import com.demo.network.model.OpportunitySuggestion;
import com.demo.network.repository.NotificationLogRepository;
import com.demo.network.repository.NotificationSettingsRepository;
import com.demo.network.repository.OpportunityRepository;
import com.demo.network.service.batch.BatchResult;
import com.demo.network.service.batch.ChunkOutcome;
import com.demo.network.service.batch.ChunkedBatchRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Applies {@link NotificationPolicy} to every user of an account and delivers the result.
 * Delivery keys are claimed in the log before sending, so a re-run never repeats a notification.
 */
@Slf4j
@Service
public class NotificationService {

    public static final String ALERT_JOB = "notifications";
    public static final String DIGEST_JOB = "daily-digest";

    private final OpportunityRepository opportunityRepository;
    private final NotificationSettingsRepository settingsRepository;
    private final NotificationLogRepository logRepository;
    private final NotificationPolicy policy;
    private final NotificationSink sink;
    private final ChunkedBatchRunner batchRunner;
    private final NetworkProperties properties;
    private final Clock clock;

    public NotificationService(OpportunityRepository opportunityRepository,
                               NotificationSettingsRepository settingsRepository,
                               NotificationLogRepository logRepository,
                               NotificationPolicy policy,
                               NotificationSink sink,
                               ChunkedBatchRunner batchRunner,
                               NetworkProperties properties,
                               Clock clock) {
        this.opportunityRepository = opportunityRepository;
        this.settingsRepository = settingsRepository;
        this.logRepository = logRepository;
        this.policy = policy;
        this.sink = sink;
        this.batchRunner = batchRunner;
        this.properties = properties;
        this.clock = clock;
    }

    /** Real-time alerts and expiring-soon reminders for suggestions created in the recent window. */
    public BatchResult processNewOpportunities(String accountId) {
        NetworkProperties.Notification cfg = properties.getNotification();
        Instant now = clock.instant();
        List<OpportunitySuggestion> recent = opportunityRepository.listCreatedSince(
                accountId, now.minus(Duration.ofHours(cfg.getNewWindowHours())));
        List<OpportunitySuggestion> open = opportunityRepository.listPending(accountId, now);
        Duration expiringWindow = Duration.ofDays(cfg.getExpiringWindowDays());

        return batchRunner.run(ALERT_JOB, accountId, settingsRepository.listForAccount(accountId),
                properties.getBatch().getChunkSize(), NotificationSettings::userId, (chunk, outcome) -> {
                    for (NotificationSettings settings : chunk) {
                        List<PlannedNotification> plan = policy.plan(recent, open, settings,
                                key -> logRepository.wasSent(settings.userId(), key), expiringWindow, now);
                        deliver(plan, settings.userId(), now, outcome);
                    }
                });
    }

    /** At most one digest per user per UTC day, independent of real-time alerts. */
    public BatchResult sendDailyDigest(String accountId) {
        Instant now = clock.instant();
        List<OpportunitySuggestion> open = opportunityRepository.listPending(accountId, now);
        int size = properties.getNotification().getDigestSize();

        return batchRunner.run(DIGEST_JOB, accountId, settingsRepository.listForAccount(accountId),
                properties.getBatch().getChunkSize(), NotificationSettings::userId, (chunk, outcome) -> {
                    for (NotificationSettings settings : chunk) {
                        List<PlannedNotification> plan = policy.digest(open, settings,
                                key -> logRepository.wasSent(settings.userId(), key), size, now);
                        deliver(plan, settings.userId(), now, outcome);
                    }
                });
    }

    private void deliver(List<PlannedNotification> plan, String userId, Instant now, ChunkOutcome outcome) {
        for (PlannedNotification p : plan) {
            boolean claimed = false;
            for (String key : p.deliveryKeys()) {
                claimed |= logRepository.markSent(userId, key, now);
            }
            if (!claimed) {
                log.debug("Skipping {} for user {}: every key already delivered", p.notification().type(), userId);
                continue;
            }
            sink.send(p.notification());
            outcome.created(1);
        }
    }
}

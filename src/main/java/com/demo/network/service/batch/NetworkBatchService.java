package com.demo.network.service.batch;

import com.demo.network.service.discovery.RelationshipDiscoveryService;
import com.demo.network.service.notification.NotificationService;
import com.demo.network.service.opportunity.OpportunityFilter;
import com.demo.network.service.opportunity.OpportunityGenerationService;
import com.demo.network.service.opportunity.OpportunityLifecycleService;
import com.demo.network.service.scoring.ContactScoringService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry points an external scheduler calls. Each is idempotent and runs under the per-account
 * guard; a trigger for an account that is already busy returns a REJECTED result.
 */
@Slf4j
@Service
public class NetworkBatchService {

    private final AccountBatchGuard guard;
    private final RelationshipDiscoveryService discoveryService;
    private final ContactScoringService scoringService;
    private final OpportunityGenerationService generationService;
    private final OpportunityLifecycleService lifecycleService;
    private final NotificationService notificationService;
    private final Clock clock;

    public NetworkBatchService(AccountBatchGuard guard,
                               RelationshipDiscoveryService discoveryService,
                               ContactScoringService scoringService,
                               OpportunityGenerationService generationService,
                               OpportunityLifecycleService lifecycleService,
                               NotificationService notificationService,
                               Clock clock) {
        this.guard = guard;
        this.discoveryService = discoveryService;
        this.scoringService = scoringService;
        this.generationService = generationService;
        this.lifecycleService = lifecycleService;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    public BatchResult runDiscoveryBatch(String accountId) {
        return guarded(RelationshipDiscoveryService.JOB, accountId, () -> discoveryService.discoverBatch(accountId));
    }

    public BatchResult runScoringBatch(String accountId) {
        return guarded(ContactScoringService.JOB, accountId, () -> scoringService.scoreBatch(accountId));
    }

    /** Expires overdue suggestions, generates new ones, then sends real-time alerts for them. */
    public BatchResult runOpportunityGeneration(String accountId) {
        return guarded(OpportunityGenerationService.JOB, accountId, () -> {
            lifecycleService.expireOverdue(accountId);
            BatchResult generated = generationService.generate(accountId, OpportunityFilter.none());
            BatchResult alerts = notificationService.processNewOpportunities(accountId);
            log.info("Account {}: {} suggestions created, {} notifications sent", accountId,
                    generated.created(), alerts.created());
            return generated;
        });
    }

    public BatchResult sendDailyDigest(String accountId) {
        return guarded(NotificationService.DIGEST_JOB, accountId, () -> notificationService.sendDailyDigest(accountId));
    }

    private BatchResult guarded(String job, String accountId, Supplier<BatchResult> body) {
        Optional<AccountBatchGuard.Permit> permit = guard.tryAcquire(accountId);
        if (permit.isEmpty()) {
            log.warn("Refusing {} for account {}: another batch is running", job, accountId);
            return BatchResult.rejected(job, accountId, clock.instant());
        }
        try (AccountBatchGuard.Permit ignored = permit.get()) {
            return body.get();
        }
    }
}

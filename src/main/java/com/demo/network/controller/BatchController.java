package com.demo.network.controller;

import com.demo.network.service.batch.BatchResult;
import com.demo.network.service.batch.NetworkBatchService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * Manual triggers for the account-wide jobs. A trigger for an account that already has a
 * job running returns a REJECTED result rather than an error status.
 */
@Tag(name = "batch")
@RestController
@RequestMapping("/api/accounts/{accountId}/batch")
@RequiredArgsConstructor
public class BatchController {

    private final NetworkBatchService batchService;

    @PostMapping("/discovery")
    public BatchResult discovery(@PathVariable String accountId) {
        return batchService.runDiscoveryBatch(accountId);
    }

    @PostMapping("/scoring")
    public BatchResult scoring(@PathVariable String accountId) {
        return batchService.runScoringBatch(accountId);
    }

    @PostMapping("/opportunities")
    public BatchResult opportunities(@PathVariable String accountId) {
        return batchService.runOpportunityGeneration(accountId);
    }

    @PostMapping("/digest")
    public BatchResult digest(@PathVariable String accountId) {
        return batchService.sendDailyDigest(accountId);
    }
}

package com.demo.network.controller;

import com.demo.network.controller.dto.FeedbackRequest;
import com.demo.network.controller.dto.OpportunityFilterRequest;
import com.demo.network.controller.dto.StatusUpdateRequest;
import com.demo.network.model.LearningSignal;
import com.demo.network.model.OpportunityStatus;
import com.demo.network.model.OpportunitySuggestion;
import com.demo.network.service.opportunity.OpportunityFilter;
import com.demo.network.service.opportunity.OpportunityGenerationService;
import com.demo.network.service.opportunity.OpportunityLifecycleService;
import com.demo.network.service.tracking.RecalibrationReport;
import com.demo.network.service.tracking.RecalibrationService;
import com.demo.network.service.tracking.SuccessMetrics;
import com.demo.network.service.tracking.SuccessTrackingService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "opportunities")
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class OpportunityController {

    private final OpportunityGenerationService generationService;
    private final OpportunityLifecycleService lifecycleService;
    private final SuccessTrackingService trackingService;
    private final RecalibrationService recalibrationService;

    // Open suggestions, overdue ones swept to EXPIRED first
    @GetMapping("/accounts/{accountId}/opportunities")
    public List<OpportunitySuggestion> active(@PathVariable String accountId) {
        return lifecycleService.listActive(accountId);
    }

    @PostMapping("/accounts/{accountId}/opportunities/preview")
    public List<OpportunitySuggestion> preview(@PathVariable String accountId,
                                               @RequestBody(required = false) OpportunityFilterRequest body) {
        OpportunityFilter filter = body != null ? body.toFilter() : OpportunityFilter.none();
        return generationService.preview(accountId, filter);
    }

    @GetMapping("/accounts/{accountId}/metrics")
    public SuccessMetrics metrics(@PathVariable String accountId,
                                  @RequestParam(defaultValue = "30") int windowDays) {
        return trackingService.computeMetrics(accountId, windowDays);
    }

    @GetMapping("/accounts/{accountId}/recalibration")
    public RecalibrationReport recalibration(@PathVariable String accountId,
                                             @RequestParam(defaultValue = "30") int windowDays) {
        return recalibrationService.report(accountId, windowDays);
    }

    @GetMapping("/opportunities/{id}")
    public OpportunitySuggestion get(@PathVariable String id) {
        return lifecycleService.get(id);
    }

    @PutMapping("/opportunities/{id}/status")
    public OpportunitySuggestion updateStatus(@PathVariable String id, @Valid @RequestBody StatusUpdateRequest body) {
        return lifecycleService.updateStatus(id, body.status);
    }

    @PostMapping("/opportunities/{id}/dismiss")
    public OpportunitySuggestion dismiss(@PathVariable String id) {
        return lifecycleService.updateStatus(id, OpportunityStatus.REJECTED);
    }

    @PostMapping("/opportunities/{id}/feedback")
    public LearningSignal feedback(@PathVariable String id, @Valid @RequestBody FeedbackRequest body) {
        return trackingService.recordFeedback(body.toCommand(id));
    }
}

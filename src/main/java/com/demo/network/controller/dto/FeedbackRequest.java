package com.demo.network.controller.dto;

import com.demo.network.model.ActualOutcome;
import com.demo.network.service.tracking.FeedbackCommand;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonIgnoreProperties(ignoreUnknown = true)
public class FeedbackRequest {
    @NotBlank
    public String userId;
    @Min(1) @Max(5)
    public int rating;
    @NotNull
    public ActualOutcome actualOutcome;
    public double actualImpact;
    public double timeInvestedHours;
    public String freeText;

    public FeedbackCommand toCommand(String opportunityId) {
        return new FeedbackCommand(opportunityId, userId, rating, actualOutcome,
                actualImpact, timeInvestedHours, freeText);
    }
}

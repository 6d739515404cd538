package com.demo.network.controller.dto;

import com.demo.network.model.OpportunityStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StatusUpdateRequest {
    @NotNull
    public OpportunityStatus status;
}

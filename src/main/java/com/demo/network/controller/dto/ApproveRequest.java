package com.demo.network.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ApproveRequest {
    public boolean mutual;
    public String notes;
}

package com.demo.network.controller.dto;

import com.demo.network.model.OpportunityCategory;
import com.demo.network.model.OpportunityPriority;
import com.demo.network.model.OpportunityType;
import com.demo.network.service.opportunity.OpportunityFilter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Set;

/** Body of the preview endpoint; every field is optional. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OpportunityFilterRequest {
    public Set<OpportunityCategory> categories;
    public Set<OpportunityType> types;
    public Set<OpportunityPriority> priorities;
    public Double minConfidence;
    public Double minImpact;
    public Set<String> contactIds;
    public Integer limit;

    public OpportunityFilter toFilter() {
        return new OpportunityFilter(categories, types, priorities, minConfidence, minImpact, contactIds, limit);
    }
}

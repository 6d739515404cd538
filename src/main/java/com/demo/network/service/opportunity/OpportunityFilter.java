package com.demo.network.service.opportunity;

import com.demo.network.model.OpportunityCategory;
import com.demo.network.model.OpportunityPriority;
import com.demo.network.model.OpportunitySuggestion;
import com.demo.network.model.OpportunityType;

import java.util.Set;

/** Optional narrowing applied to generated suggestions. Null or empty fields do not filter. */
public record OpportunityFilter(
        Set<OpportunityCategory> categories,
        Set<OpportunityType> types,
        Set<OpportunityPriority> priorities,
        Double minConfidence,
        Double minImpact,
        Set<String> contactIds,
        Integer limit
) {

    public static OpportunityFilter none() {
        return new OpportunityFilter(null, null, null, null, null, null, null);
    }

    public boolean matches(OpportunitySuggestion s) {
        if (categories != null && !categories.isEmpty() && !categories.contains(s.category())) return false;
        if (types != null && !types.isEmpty() && !types.contains(s.type())) return false;
        if (priorities != null && !priorities.isEmpty() && !priorities.contains(s.priority())) return false;
        if (minConfidence != null && s.confidenceScore() < minConfidence) return false;
        if (minImpact != null && s.impactScore() < minImpact) return false;
        return contactIds == null || contactIds.isEmpty() || contactIds.contains(s.primaryContactId());
    }

    public int limitOr(int fallback) {
        return limit == null || limit <= 0 ? fallback : Math.min(limit, fallback);
    }
}

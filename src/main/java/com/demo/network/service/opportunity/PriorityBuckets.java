package com.demo.network.service.opportunity;

import com.demo.network.model.OpportunityPriority;

/**
 * Maps {@code p = confidence x impact} (0-100) onto a priority. Monotonic in p and
 * independent of category.
 */
public final class PriorityBuckets {

    public static final double URGENT = 85;
    public static final double HIGH = 65;
    public static final double MEDIUM = 40;

    private PriorityBuckets() {
    }

    public static OpportunityPriority bucket(double confidence, double impact) {
        double p = confidence * impact;
        if (p >= URGENT) return OpportunityPriority.URGENT;
        if (p >= HIGH) return OpportunityPriority.HIGH;
        if (p >= MEDIUM) return OpportunityPriority.MEDIUM;
        return OpportunityPriority.LOW;
    }
}

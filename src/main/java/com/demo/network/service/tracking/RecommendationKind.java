package com.demo.network.service.tracking;

public enum RecommendationKind {
    RAISE_CONFIDENCE_FLOOR,
    LOWER_CONFIDENCE_FLOOR,
    IMPROVE_ACTIONABILITY,
    IMPROVE_URGENCY,
    CATEGORY_UNDERPERFORMING,
    RECALIBRATE_CONFIDENCE,
    IMPROVE_ENGAGEMENT
}

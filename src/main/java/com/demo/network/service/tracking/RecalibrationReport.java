package com.demo.network.service.tracking;

import java.time.Instant;
import java.util.List;

public record RecalibrationReport(
        String accountId,
        String weightsVersion,
        SuccessMetrics metrics,
        List<Recommendation> recommendations,
        Instant generatedAt
) {

    public RecalibrationReport {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}

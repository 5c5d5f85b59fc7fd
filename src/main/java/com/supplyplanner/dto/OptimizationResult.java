package com.supplyplanner.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class OptimizationResult {
    String snapshotFingerprint;
    ForecastResult forecast;
    AllocationResult allocation;
    RoutingResult routing;
    MetricsResult metrics;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
}

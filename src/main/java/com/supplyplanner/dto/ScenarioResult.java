package com.supplyplanner.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.supplyplanner.domain.ScenarioSpec;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ScenarioResult {
    UUID runId;
    String name;
    ScenarioSpec spec;
    String baselineFingerprint;
    String scenarioFingerprint;
    OptimizationResult baseline;
    OptimizationResult scenario;
    ScenarioComparison comparison;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant completedAt;
}

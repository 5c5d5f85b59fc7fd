package com.supplyplanner.service;

import com.supplyplanner.domain.InputSnapshot;
import com.supplyplanner.dto.AllocationResult;
import com.supplyplanner.dto.ForecastResult;
import com.supplyplanner.dto.MetricsResult;
import com.supplyplanner.dto.OptimizationResult;
import com.supplyplanner.dto.RoutingResult;
import com.supplyplanner.dto.RunStage;
import com.supplyplanner.dto.SolveStatus;
import com.supplyplanner.exception.PipelineStageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Forecast, allocate, route and aggregate one snapshot, strictly in that order.
 * Snapshot validation failures surface as-is; any failure inside a stage is rethrown as a
 * {@link PipelineStageException} carrying the stage and snapshot fingerprint.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptimizationPipeline {

    private final SnapshotValidator snapshotValidator;
    private final SnapshotFingerprinter fingerprinter;
    private final DemandForecastService forecastService;
    private final AllocationOptimizerService allocationService;
    private final RoutingOptimizerService routingService;
    private final MetricsAggregatorService metricsService;

    public OptimizationResult run(InputSnapshot snapshot) {
        return run(snapshot, StageListener.NONE);
    }

    public OptimizationResult run(InputSnapshot snapshot, StageListener listener) {
        snapshotValidator.validate(snapshot);
        String fingerprint = fingerprinter.fingerprint(snapshot);
        long seed = fingerprinter.seed(fingerprint);
        log.info("Pipeline started | label={} | fingerprint={}", snapshot.getLabel(), fingerprint);

        ForecastResult forecast = stage(RunStage.FORECASTING, fingerprint, listener,
                () -> forecastService.forecast(snapshot.getDemands(), seed));
        AllocationResult allocation = stage(RunStage.ALLOCATING, fingerprint, listener,
                () -> allocationService.allocate(snapshot, forecast));
        RoutingResult routing = stage(RunStage.ROUTING, fingerprint, listener,
                () -> allocation.getStatus() == SolveStatus.INFEASIBLE
                        ? RoutingResult.skipped("Allocation is infeasible; nothing to route")
                        : routingService.route(snapshot, allocation));
        MetricsResult metrics = stage(RunStage.AGGREGATING, fingerprint, listener,
                () -> metricsService.aggregate(forecast, allocation, routing));

        log.info("Pipeline completed | fingerprint={} | allocation={} | routing={} | totalCost={} | violations={}",
                fingerprint, allocation.getStatus(), routing.getStatus(), metrics.getTotalCost(),
                metrics.getConstraintViolations().size());

        return OptimizationResult.builder()
                .snapshotFingerprint(fingerprint)
                .forecast(forecast)
                .allocation(allocation)
                .routing(routing)
                .metrics(metrics)
                .generatedAt(Instant.now())
                .build();
    }

    private <T> T stage(RunStage stage, String fingerprint, StageListener listener, Supplier<T> body) {
        try {
            listener.entering(stage);
            return body.get();
        } catch (PipelineStageException ex) {
            throw ex;
        } catch (CancellationException ex) {
            log.info("Pipeline stage cancelled | stage={} | fingerprint={}", stage, fingerprint);
            throw new PipelineStageException(stage, fingerprint, ex);
        } catch (RuntimeException ex) {
            log.error("Pipeline stage failed | stage={} | fingerprint={} | error={}", stage, fingerprint, ex.getMessage(), ex);
            throw new PipelineStageException(stage, fingerprint, ex);
        }
    }
}

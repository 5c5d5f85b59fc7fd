package com.supplyplanner.service;

import com.supplyplanner.domain.InputSnapshot;
import com.supplyplanner.domain.ScenarioSpec;
import com.supplyplanner.dto.OptimizationResult;
import com.supplyplanner.dto.RunStage;
import com.supplyplanner.dto.ScenarioComparison;
import com.supplyplanner.dto.ScenarioResult;
import com.supplyplanner.dto.ScenarioRunStatus;
import com.supplyplanner.exception.InternalSolverException;
import com.supplyplanner.exception.PipelineStageException;
import com.supplyplanner.exception.ScenarioRunNotFoundException;
import com.supplyplanner.exception.SupplyPlannerException;
import com.supplyplanner.exception.ValidationException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Runs what-if scenarios against a baseline snapshot on a fixed worker pool.
 * <p>
 * Requests are keyed by (scenario spec, baseline fingerprint). At most one computation per key
 * is in flight; later identical requests join it or, once it finished, get the retained result.
 * Baseline optimizations are shared the same way per fingerprint.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScenarioEngineService {

    @Value("${scenarios.pool-size:4}")
    private int poolSize;

    @Value("${scenarios.max-retained:200}")
    private int maxRetained;

    private final OptimizationPipeline pipeline;
    private final ScenarioTransformer transformer;
    private final SnapshotValidator snapshotValidator;
    private final SnapshotFingerprinter fingerprinter;

    private ExecutorService executor;
    private final ConcurrentHashMap<RunKey, Flight> flights = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<OptimizationResult>> baselines = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, ScenarioRun> runs = new ConcurrentHashMap<>();

    private record RunKey(ScenarioSpec spec, String baselineFingerprint) {
    }

    private record Flight(UUID runId, CompletableFuture<ScenarioResult> future) {
    }

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(2, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    /**
     * Optimizes the snapshot as-is on the calling thread, or joins an identical computation.
     */
    public OptimizationResult runBaseline(InputSnapshot snapshot) {
        snapshotValidator.validate(snapshot);
        String fingerprint = fingerprinter.fingerprint(snapshot);
        return await(baselineFuture(snapshot, fingerprint));
    }

    /**
     * Cancelling the subscription does not cancel the shared computation.
     */
    public Mono<ScenarioResult> runScenario(ScenarioSpec spec, InputSnapshot baseline) {
        return Mono.defer(() -> Mono.fromFuture(launch(spec, baseline).future().copy()));
    }

    public ScenarioResult runScenarioBlocking(ScenarioSpec spec, InputSnapshot baseline) {
        return runScenario(spec, baseline)
                .blockOptional()
                .orElseThrow(() -> new InternalSolverException("Scenario '" + spec.getName() + "' produced no result"));
    }

    public UUID submitScenario(ScenarioSpec spec, InputSnapshot baseline) {
        return launch(spec, baseline).runId();
    }

    public ScenarioRunStatus getRun(UUID runId) {
        ScenarioRun run = runs.get(runId);
        if (run == null) {
            throw new ScenarioRunNotFoundException(runId);
        }
        return run.toStatus();
    }

    /**
     * Requests cancellation; the run stops before its next stage. Returns false if it already finished.
     * <p>
     * Identical requests share one run, so every caller joined to it fails with the cancellation too.
     * Requests arriving after the cancel start a fresh run.
     */
    public boolean cancel(UUID runId) {
        ScenarioRun run = runs.get(runId);
        if (run == null) {
            throw new ScenarioRunNotFoundException(runId);
        }
        boolean accepted = run.requestCancel();
        log.info("Scenario cancel requested | runId={} | accepted={}", runId, accepted);
        return accepted;
    }

    /** Completed scenario results, oldest first. */
    public List<ScenarioResult> listResults() {
        return runs.values().stream()
                .map(ScenarioRun::result)
                .filter(r -> r != null)
                .sorted(Comparator.comparing(ScenarioResult::getCompletedAt))
                .toList();
    }

    private Flight launch(ScenarioSpec spec, InputSnapshot baseline) {
        if (spec == null) {
            throw new ValidationException("scenario spec is required");
        }
        snapshotValidator.validate(baseline);
        String baselineFingerprint = fingerprinter.fingerprint(baseline);
        RunKey key = new RunKey(spec, baselineFingerprint);
        Flight created = new Flight(UUID.randomUUID(), new CompletableFuture<>());

        while (true) {
            Flight existing = flights.putIfAbsent(key, created);
            if (existing == null) {
                break;
            }
            ScenarioRun existingRun = runs.get(existing.runId());
            if (existingRun == null || !existingRun.isCancelRequested()) {
                log.debug("Scenario joined | name={} | runId={}", spec.getName(), existing.runId());
                return existing;
            }
            if (flights.replace(key, existing, created)) {
                break;
            }
        }

        ScenarioRun run = new ScenarioRun(created.runId(), spec.getName(), baselineFingerprint);
        runs.put(run.runId(), run);
        cleanupIfNeeded();
        log.info("Scenario submitted | name={} | runId={} | baseline={}", spec.getName(), run.runId(), baselineFingerprint);
        try {
            executor.execute(() -> execute(key, created, run, baseline));
        } catch (RejectedExecutionException ex) {
            flights.remove(key, created);
            run.markFailed(RunStage.RECEIVED, "scenario executor rejected the run");
            throw new InternalSolverException("Scenario executor rejected run " + run.runId(), ex);
        }
        return created;
    }

    private void execute(RunKey key, Flight flight, ScenarioRun run, InputSnapshot baseline) {
        ScenarioSpec spec = key.spec();
        run.markStarted();
        try {
            OptimizationResult baselineResult = await(baselineFuture(baseline, key.baselineFingerprint()));
            run.advance(RunStage.TRANSFORMING);
            InputSnapshot perturbed = transformer.apply(baseline, spec);
            OptimizationResult scenarioResult = pipeline.run(perturbed, run::advance);
            ScenarioComparison comparison = ScenarioComparison.between(baselineResult.getMetrics(), scenarioResult.getMetrics());

            ScenarioResult result = ScenarioResult.builder()
                    .runId(run.runId())
                    .name(spec.getName())
                    .spec(spec)
                    .baselineFingerprint(key.baselineFingerprint())
                    .scenarioFingerprint(scenarioResult.getSnapshotFingerprint())
                    .baseline(baselineResult)
                    .scenario(scenarioResult)
                    .comparison(comparison)
                    .completedAt(Instant.now())
                    .build();
            run.markCompleted(result);
            flight.future().complete(result);
            log.info("Scenario completed | name={} | runId={} | costDelta={} | improvement={}",
                    spec.getName(), run.runId(), comparison.getCostDelta(), comparison.isImprovement());
        } catch (RuntimeException ex) {
            RunStage failedAt = ex instanceof PipelineStageException stageFailure ? stageFailure.getStage() : run.stage();
            String reason = run.isCancelRequested() ? "cancelled" : reasonOf(ex);
            run.markFailed(failedAt, reason);
            flights.remove(key, flight);
            log.error("Scenario failed | name={} | runId={} | stage={} | reason={}", spec.getName(), run.runId(), failedAt, reason);
            flight.future().completeExceptionally(ex instanceof SupplyPlannerException
                    ? ex
                    : new PipelineStageException(failedAt, key.baselineFingerprint(), ex));
        }
    }

    private CompletableFuture<OptimizationResult> baselineFuture(InputSnapshot snapshot, String fingerprint) {
        CompletableFuture<OptimizationResult> created = new CompletableFuture<>();
        CompletableFuture<OptimizationResult> existing = baselines.putIfAbsent(fingerprint, created);
        if (existing != null) {
            return existing;
        }
        try {
            created.complete(pipeline.run(snapshot));
        } catch (RuntimeException ex) {
            baselines.remove(fingerprint, created);
            created.completeExceptionally(ex);
        }
        return created;
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new InternalSolverException("Computation failed", ex.getCause());
        }
    }

    private void cleanupIfNeeded() {
        if (runs.size() > maxRetained) {
            Set<UUID> evicted = runs.values().stream()
                    .filter(ScenarioRun::isTerminal)
                    .sorted(Comparator.comparing(ScenarioRun::createdAt))
                    .limit(Math.max(1, runs.size() - maxRetained))
                    .map(ScenarioRun::runId)
                    .collect(Collectors.toSet());
            evicted.forEach(runs::remove);
            flights.entrySet().removeIf(e -> evicted.contains(e.getValue().runId()));
        }
        if (baselines.size() > maxRetained) {
            baselines.entrySet().removeIf(e -> e.getValue().isDone());
        }
    }

    private static String reasonOf(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}

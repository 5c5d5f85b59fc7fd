package com.supplyplanner.service;

import com.supplyplanner.SupplyChainFixtures;
import com.supplyplanner.domain.InputSnapshot;
import com.supplyplanner.domain.ScenarioSpec;
import com.supplyplanner.dto.MetricsResult;
import com.supplyplanner.dto.OptimizationResult;
import com.supplyplanner.dto.RunStage;
import com.supplyplanner.dto.ScenarioResult;
import com.supplyplanner.dto.ScenarioRunStatus;
import com.supplyplanner.exception.PipelineStageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScenarioEngineConcurrencyTest {

    @Mock
    OptimizationPipeline pipeline;
    @Mock
    ScenarioTransformer transformer;
    @Mock
    SnapshotValidator snapshotValidator;
    @Mock
    SnapshotFingerprinter fingerprinter;

    private ScenarioEngineService engine;

    private final InputSnapshot baseline = SupplyChainFixtures.baseline();
    private final InputSnapshot perturbed = SupplyChainFixtures.baselineBuilder().label("perturbed").build();
    private final ScenarioSpec spec = ScenarioSpec.builder().name("surge").demandMultiplier(1.3).build();
    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);

    private static OptimizationResult result(String fingerprint, double cost) {
        return OptimizationResult.builder()
                .snapshotFingerprint(fingerprint)
                .metrics(MetricsResult.builder().totalCost(cost).build())
                .build();
    }

    @BeforeEach
    void setUp() {
        engine = new ScenarioEngineService(pipeline, transformer, snapshotValidator, fingerprinter);
        ReflectionTestUtils.setField(engine, "poolSize", 2);
        ReflectionTestUtils.setField(engine, "maxRetained", 10);
        engine.init();

        when(fingerprinter.fingerprint(baseline)).thenReturn("base");
        when(pipeline.run(baseline)).thenReturn(result("base", 100.0));
        when(transformer.apply(baseline, spec)).thenReturn(perturbed);
        when(pipeline.run(eq(perturbed), any(StageListener.class))).thenAnswer(invocation -> {
            StageListener listener = invocation.getArgument(1);
            listener.entering(RunStage.FORECASTING);
            entered.countDown();
            assertThat(release.await(5, TimeUnit.SECONDS)).isTrue();
            listener.entering(RunStage.ALLOCATING);
            listener.entering(RunStage.ROUTING);
            listener.entering(RunStage.AGGREGATING);
            return result("perturbed", 130.0);
        });
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        engine.shutdown();
    }

    private ScenarioRunStatus awaitTerminal(UUID runId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        ScenarioRunStatus status = engine.getRun(runId);
        while (!status.getStage().isTerminal() && System.nanoTime() < deadline) {
            Thread.sleep(10);
            status = engine.getRun(runId);
        }
        return status;
    }

    @Test
    void concurrentIdenticalRequests_computedOnce() throws InterruptedException {
        UUID first = engine.submitScenario(spec, baseline);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        UUID second = engine.submitScenario(spec, baseline);

        assertThat(engine.getRun(first).getStage()).isEqualTo(RunStage.FORECASTING);
        release.countDown();
        var result = engine.runScenarioBlocking(spec, baseline);

        assertThat(second).isEqualTo(first);
        assertThat(result.getRunId()).isEqualTo(first);
        assertThat(result.getComparison().getCostDelta()).isCloseTo(30.0, within(1e-9));
        verify(pipeline, times(1)).run(baseline);
        verify(pipeline, times(1)).run(eq(perturbed), any(StageListener.class));
    }

    @Test
    void cancel_inFlight_stopsBeforeNextStage() throws InterruptedException {
        UUID runId = engine.submitScenario(spec, baseline);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(engine.cancel(runId)).isTrue();
        release.countDown();

        var status = awaitTerminal(runId);
        assertThat(status.getStage()).isEqualTo(RunStage.FAILED);
        assertThat(status.getFailedStage()).isEqualTo(RunStage.FORECASTING);
        assertThat(status.getMessage()).isEqualTo("cancelled");
        assertThat(status.isCancelRequested()).isTrue();
        assertThat(engine.listResults()).isEmpty();
    }

    @Test
    void cancel_joinedRun_failsEveryJoinedCaller() throws InterruptedException {
        UUID runId = engine.submitScenario(spec, baseline);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<ScenarioResult> joined = engine.runScenario(spec, baseline).toFuture();

        assertThat(engine.cancel(runId)).isTrue();
        release.countDown();

        assertThatThrownBy(() -> joined.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(PipelineStageException.class);
        assertThat(awaitTerminal(runId).getMessage()).isEqualTo("cancelled");
        verify(pipeline, times(1)).run(eq(perturbed), any(StageListener.class));
    }
}

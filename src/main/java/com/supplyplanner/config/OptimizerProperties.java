package com.supplyplanner.config;

import com.supplyplanner.domain.RouteEdge;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tuning knobs for the optimization pipeline, bound from {@code optimizer.*}.
 * Every field has a default so that {@code new OptimizerProperties()} is a usable configuration.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

    @Valid
    private Forecast forecast = new Forecast();

    @Valid
    private Allocation allocation = new Allocation();

    @Valid
    private Routing routing = new Routing();

    @Valid
    private Metrics metrics = new Metrics();

    @Valid
    private Scenario scenario = new Scenario();

    @Data
    public static class Forecast {
        /** Periods forecast ahead. */
        @Min(1)
        private int horizon = 6;

        /** Forecast periods summed into the demand handed to allocation. */
        @Min(1)
        private int planningPeriods = 1;

        /** Minimum distinct periods of history per store. */
        @Min(1)
        private int minHistoryPeriods = 1;

        @DecimalMin("0.0")
        private double linearTrendWeight = 0.4;

        @DecimalMin("0.0")
        private double holtWeight = 0.3;

        @DecimalMin("0.0")
        private double featureRegressionWeight = 0.3;

        /** Holt level smoothing. */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double alpha = 0.5;

        /** Holt trend smoothing. */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double beta = 0.3;

        @DecimalMin("0.0")
        private double ridgeLambda = 1.0;

        @Min(1)
        private int bootstrapSamples = 200;

        @DecimalMin("0.5") @DecimalMax("0.999")
        private double confidenceLevel = 0.9;
    }

    @Data
    public static class Allocation {
        /** Share of forecast demand each store must receive. */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double fulfillmentFloor = 1.0;

        /** Augmenting-path budget; zero or less means unbounded. */
        private int maxIterations = 10_000;

        @NotNull
        private Duration timeLimit = Duration.ofSeconds(10);
    }

    @Data
    public static class Routing {
        @DecimalMin(value = "0.0", inclusive = false)
        private double vehicleCapacity = 1000;

        @Min(1)
        private int vehiclesPerWarehouse = 5;

        /** Improvement passes; zero or less means unbounded. */
        private int maxIterations = 1_000;

        @NotNull
        private Duration timeLimit = Duration.ofSeconds(10);

        @DecimalMin("0.0")
        private double fuelCostPerKm = 0.5;

        @DecimalMin("0.0")
        private double driverCostPerHour = 25.0;

        /** Used to derive travel minutes when no time matrix is given. */
        @DecimalMin(value = "0.0", inclusive = false)
        private double averageSpeedKmh = 50.0;

        @DecimalMin("0.0")
        private double serviceTimeMinutes = 15.0;

        @DecimalMin("0.0")
        private double serviceMinutesPerUnit = 0.0;
    }

    @Data
    public static class Metrics {
        /** Relative slack before a shortfall or overload counts as a violation. */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double tolerance = 0.01;
    }

    @Data
    public static class Scenario {
        /** Edges blocked when a spec requests blockage without naming any. */
        @Valid
        private List<BlockedRoute> blockedRoutes = new ArrayList<>();

        /** Multiplier for blocked edges; zero or less removes them outright. */
        private double blockagePenaltyFactor = 0.0;

        public List<RouteEdge> defaultBlockedEdges() {
            return blockedRoutes.stream()
                    .map(r -> RouteEdge.of(r.getFrom(), r.getTo()))
                    .toList();
        }
    }

    @Data
    public static class BlockedRoute {
        @NotNull
        private String from;
        @NotNull
        private String to;
    }
}

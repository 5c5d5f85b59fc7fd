package com.supplyplanner.solver;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RouteImproverTest {

    private final RouteImprover improver = new RouteImprover();

    private static final DeliveryStop A = new DeliveryStop(1, "A", 5);
    private static final DeliveryStop B = new DeliveryStop(2, "B", 5);
    private static final DeliveryStop C = new DeliveryStop(3, "C", 5);

    @Test
    void improve_twoOptUntanglesRoute() {
        double[][] m = SavingsRouteBuilderTest.lineMatrix();
        List<List<DeliveryStop>> routes = List.of(new ArrayList<>(List.of(A, C, B)));

        RouteImprover.Outcome outcome = improver.improve(routes, 0, m, m, 100, SolveBudget.unbounded());

        assertThat(outcome.budgetHit()).isFalse();
        assertThat(outcome.routes()).hasSize(1);
        assertThat(RouteMetrics.tour(outcome.routes().get(0), 0, m)).isCloseTo(42.0, within(1e-9));
        assertThat(outcome.routes().get(0)).containsExactlyInAnyOrder(A, B, C);
    }

    @Test
    void improve_relocateMergesNeighbouringRoutes() {
        double[][] m = SavingsRouteBuilderTest.lineMatrix();
        List<List<DeliveryStop>> routes = List.of(List.of(A), List.of(B));

        RouteImprover.Outcome outcome = improver.improve(routes, 0, m, m, 100, SolveBudget.unbounded());

        assertThat(outcome.routes()).hasSize(1);
        assertThat(RouteMetrics.tour(outcome.routes().get(0), 0, m)).isCloseTo(22.0, within(1e-9));
    }

    @Test
    void improve_relocateRespectsCapacity() {
        double[][] m = SavingsRouteBuilderTest.lineMatrix();
        List<List<DeliveryStop>> routes = List.of(List.of(A), List.of(B));

        RouteImprover.Outcome outcome = improver.improve(routes, 0, m, m, 8, SolveBudget.unbounded());

        assertThat(outcome.routes()).hasSize(2);
    }

    @Test
    void improve_neverIntroducesImpassableEdge() {
        double[][] m = SavingsRouteBuilderTest.lineMatrix();
        m[1][2] = Double.POSITIVE_INFINITY;
        m[2][1] = Double.POSITIVE_INFINITY;
        List<List<DeliveryStop>> routes = List.of(List.of(A), List.of(B));

        RouteImprover.Outcome outcome = improver.improve(routes, 0, m, m, 100, SolveBudget.unbounded());

        assertThat(outcome.routes()).hasSize(2);
        for (List<DeliveryStop> route : outcome.routes()) {
            assertThat(RouteMetrics.tour(route, 0, m)).isFinite();
        }
    }

    @Test
    void improve_exhaustedBudget_reportsBudgetHitAndKeepsRoutes() {
        double[][] m = SavingsRouteBuilderTest.lineMatrix();
        SolveBudget budget = SolveBudget.of(1, null);
        List<List<DeliveryStop>> routes = List.of(new ArrayList<>(List.of(A, C, B)));

        RouteImprover.Outcome outcome = improver.improve(routes, 0, m, m, 100, budget);

        assertThat(outcome.budgetHit()).isTrue();
        assertThat(outcome.routes().get(0)).containsExactlyInAnyOrder(A, B, C);
    }
}

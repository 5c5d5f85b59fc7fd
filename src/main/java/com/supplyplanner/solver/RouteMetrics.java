package com.supplyplanner.solver;

import java.util.List;

/**
 * Closed-tour totals from a depot over a node sequence.
 */
final class RouteMetrics {

    private RouteMetrics() {
    }

    static double tour(List<DeliveryStop> route, int depot, double[][] matrix) {
        if (route.isEmpty()) {
            return 0.0;
        }
        double total = matrix[depot][route.get(0).node()];
        for (int k = 1; k < route.size(); k++) {
            total += matrix[route.get(k - 1).node()][route.get(k).node()];
        }
        return total + matrix[route.get(route.size() - 1).node()][depot];
    }

    static double load(List<DeliveryStop> route) {
        double load = 0.0;
        for (DeliveryStop stop : route) {
            load += stop.quantity();
        }
        return load;
    }
}

package com.supplyplanner.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * First-improvement local search over the routes of one depot: intra-route 2-opt, then
 * inter-route relocate. Moves are ranked by distance, then time; a move that would use a
 * non-finite edge never counts as an improvement.
 */
public class RouteImprover {

    private static final double EPS = 1e-9;

    public record Outcome(List<List<DeliveryStop>> routes, boolean budgetHit) {
    }

    public Outcome improve(List<List<DeliveryStop>> initial, int depot, double[][] distance,
                           double[][] time, double capacity, SolveBudget budget) {
        List<List<DeliveryStop>> routes = new ArrayList<>();
        for (List<DeliveryStop> route : initial) {
            routes.add(new ArrayList<>(route));
        }
        boolean improved = true;
        while (improved) {
            if (!budget.tryConsume()) {
                routes.removeIf(List::isEmpty);
                return new Outcome(routes, true);
            }
            improved = twoOpt(routes, depot, distance, time) || relocate(routes, depot, distance, time, capacity);
        }
        routes.removeIf(List::isEmpty);
        return new Outcome(routes, false);
    }

    private boolean twoOpt(List<List<DeliveryStop>> routes, int depot, double[][] distance, double[][] time) {
        for (int r = 0; r < routes.size(); r++) {
            List<DeliveryStop> route = routes.get(r);
            double currentDistance = RouteMetrics.tour(route, depot, distance);
            double currentTime = RouteMetrics.tour(route, depot, time);
            for (int i = 0; i < route.size() - 1; i++) {
                for (int j = i + 1; j < route.size(); j++) {
                    List<DeliveryStop> candidate = new ArrayList<>(route);
                    Collections.reverse(candidate.subList(i, j + 1));
                    if (better(RouteMetrics.tour(candidate, depot, distance), RouteMetrics.tour(candidate, depot, time),
                            currentDistance, currentTime)) {
                        routes.set(r, candidate);
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private boolean relocate(List<List<DeliveryStop>> routes, int depot, double[][] distance,
                             double[][] time, double capacity) {
        for (int a = 0; a < routes.size(); a++) {
            List<DeliveryStop> source = routes.get(a);
            for (int p = 0; p < source.size(); p++) {
                DeliveryStop moved = source.get(p);
                List<DeliveryStop> shrunk = new ArrayList<>(source);
                shrunk.remove(p);
                for (int b = 0; b < routes.size(); b++) {
                    if (b == a) continue;
                    List<DeliveryStop> target = routes.get(b);
                    if (RouteMetrics.load(target) + moved.quantity() > capacity + EPS) continue;
                    double beforeDistance = RouteMetrics.tour(source, depot, distance) + RouteMetrics.tour(target, depot, distance);
                    double beforeTime = RouteMetrics.tour(source, depot, time) + RouteMetrics.tour(target, depot, time);
                    for (int q = 0; q <= target.size(); q++) {
                        List<DeliveryStop> grown = new ArrayList<>(target);
                        grown.add(q, moved);
                        double afterDistance = RouteMetrics.tour(shrunk, depot, distance) + RouteMetrics.tour(grown, depot, distance);
                        double afterTime = RouteMetrics.tour(shrunk, depot, time) + RouteMetrics.tour(grown, depot, time);
                        if (better(afterDistance, afterTime, beforeDistance, beforeTime)) {
                            routes.set(a, shrunk);
                            routes.set(b, grown);
                            return true;
                        }
                    }
                }
            }
        }
        return false;
    }

    private static boolean better(double distance, double time, double currentDistance, double currentTime) {
        if (!Double.isFinite(distance) || !Double.isFinite(time)) {
            return false;
        }
        if (distance < currentDistance - EPS) {
            return true;
        }
        return Math.abs(distance - currentDistance) <= EPS && time < currentTime - EPS;
    }
}

package com.supplyplanner.solver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Clarke-Wright savings construction for one depot on possibly asymmetric matrices.
 * A merge appends route B after route A when A ends at i, B starts at j, the combined
 * load fits the vehicle and the edge i to j is finite.
 */
public class SavingsRouteBuilder {

    private static final double EPS = 1e-9;

    private record Saving(int from, int to, double distance, double time) {
    }

    /**
     * Every stop must have a finite out-and-back from the depot and carry at most {@code capacity}.
     */
    public List<List<DeliveryStop>> build(int depot, List<DeliveryStop> stops,
                                          double[][] distance, double[][] time, double capacity) {
        int n = stops.size();
        List<List<Integer>> routes = new ArrayList<>(n);
        int[] routeOf = new int[n];
        double[] loads = new double[n];
        for (int k = 0; k < n; k++) {
            List<Integer> single = new ArrayList<>();
            single.add(k);
            routes.add(single);
            routeOf[k] = k;
            loads[k] = stops.get(k).quantity();
        }

        List<Saving> savings = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            int ni = stops.get(i).node();
            for (int j = 0; j < n; j++) {
                if (i == j) continue;
                int nj = stops.get(j).node();
                if (!Double.isFinite(distance[ni][nj]) || !Double.isFinite(time[ni][nj])) continue;
                double saved = distance[ni][depot] + distance[depot][nj] - distance[ni][nj];
                if (saved <= EPS) continue;
                double savedTime = time[ni][depot] + time[depot][nj] - time[ni][nj];
                savings.add(new Saving(i, j, saved, savedTime));
            }
        }
        savings.sort(Comparator.comparingDouble(Saving::distance).reversed()
                .thenComparing(Comparator.comparingDouble(Saving::time).reversed())
                .thenComparing(s -> stops.get(s.from()).locationId())
                .thenComparing(s -> stops.get(s.to()).locationId()));

        for (Saving saving : savings) {
            int ri = routeOf[saving.from()];
            int rj = routeOf[saving.to()];
            if (ri == rj) continue;
            List<Integer> head = routes.get(ri);
            List<Integer> tail = routes.get(rj);
            if (head.get(head.size() - 1) != saving.from() || tail.get(0) != saving.to()) continue;
            if (loads[ri] + loads[rj] > capacity + EPS) continue;
            head.addAll(tail);
            loads[ri] += loads[rj];
            for (int k : tail) {
                routeOf[k] = ri;
            }
            routes.set(rj, null);
        }

        List<List<DeliveryStop>> built = new ArrayList<>();
        for (List<Integer> route : routes) {
            if (route == null) continue;
            built.add(new ArrayList<>(route.stream().map(stops::get).toList()));
        }
        return built;
    }
}

package com.supplyplanner.solver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Min-cost transportation problem solved as a min-cost flow: source to warehouse
 * (capacity), warehouse to store (unit cost, unbounded), store to sink (requirement).
 * Successive shortest paths with Bellman-Ford on the residual network; node and edge
 * order follow the caller's index order so ties always resolve the same way.
 * <p>
 * After the flow is found, cycles in the support graph are cancelled in their
 * non-increasing cost direction, which leaves a forest support with at most
 * {@code W + S - 1} used edges.
 */
public class TransportationSolver {

    private static final double EPS = 1e-9;
    private static final double COST_EPS = 1e-12;

    public enum Outcome {
        OPTIMAL,
        TIME_LIMIT_REACHED,
        INFEASIBLE
    }

    /**
     * {@code flow[w][s]} is all zeros when the outcome is {@link Outcome#INFEASIBLE}.
     */
    public record Solution(Outcome outcome, double[][] flow, int iterations, String message) {
    }

    /**
     * @param supply capacity per warehouse
     * @param demand requirement per store
     * @param cost   unit cost per warehouse and store; non-finite entries mean no edge
     */
    public Solution solve(double[] supply, double[] demand, double[][] cost, SolveBudget budget) {
        int warehouses = supply.length;
        int stores = demand.length;
        int source = 0;
        int sink = warehouses + stores + 1;
        Network network = new Network(warehouses + stores + 2);

        for (int w = 0; w < warehouses; w++) {
            network.addEdge(source, 1 + w, supply[w], 0.0);
        }
        Edge[][] arcs = new Edge[warehouses][stores];
        for (int w = 0; w < warehouses; w++) {
            for (int s = 0; s < stores; s++) {
                if (Double.isFinite(cost[w][s])) {
                    arcs[w][s] = network.addEdge(1 + w, 1 + warehouses + s, Double.POSITIVE_INFINITY, cost[w][s]);
                }
            }
        }
        double required = 0.0;
        for (int s = 0; s < stores; s++) {
            network.addEdge(1 + warehouses + s, sink, demand[s], 0.0);
            required += demand[s];
        }

        double sent = 0.0;
        boolean budgetHit = false;
        while (sent < required - EPS) {
            if (!budget.tryConsume()) {
                budgetHit = true;
                break;
            }
            Edge[] via = network.cheapestPath(source, sink);
            if (via == null) {
                break;
            }
            sent += network.augment(via, source, sink);
        }
        if (budgetHit) {
            // finish feasibility without regard to cost
            Edge[] via;
            while (sent < required - EPS && (via = network.shortestHopPath(source, sink)) != null) {
                sent += network.augment(via, source, sink);
            }
        }

        if (sent < required - (EPS + required * 1e-9)) {
            return new Solution(Outcome.INFEASIBLE, new double[warehouses][stores], budget.iterations(),
                    String.format("Maximum flow %.4f is short of required demand %.4f", sent, required));
        }

        double[][] flow = new double[warehouses][stores];
        for (int w = 0; w < warehouses; w++) {
            for (int s = 0; s < stores; s++) {
                if (arcs[w][s] != null && arcs[w][s].flow > EPS) {
                    flow[w][s] = arcs[w][s].flow;
                }
            }
        }
        int cancelled = cancelSupportCycles(flow, cost);

        if (budgetHit) {
            return new Solution(Outcome.TIME_LIMIT_REACHED, flow, budget.iterations(),
                    "Solve budget exhausted after " + budget.iterations()
                            + " augmentations; remaining flow routed without cost guidance");
        }
        return new Solution(Outcome.OPTIMAL, flow, budget.iterations(),
                cancelled > 0 ? "Optimal; " + cancelled + " support cycle(s) cancelled" : "Optimal");
    }

    /**
     * Shifts flow around each cycle of the bipartite support graph until an edge empties.
     * The direction taken never raises total cost.
     */
    int cancelSupportCycles(double[][] flow, double[][] cost) {
        int cancelled = 0;
        int[][] cycle;
        while ((cycle = findSupportCycle(flow)) != null) {
            double delta = 0.0;
            for (int k = 0; k < cycle.length; k++) {
                double sign = k % 2 == 0 ? 1.0 : -1.0;
                delta += sign * cost[cycle[k][0]][cycle[k][1]];
            }
            // even positions gain, odd positions lose; flip when that would cost more
            int losing = delta > COST_EPS ? 0 : 1;
            double theta = Double.POSITIVE_INFINITY;
            int emptied = -1;
            for (int k = losing; k < cycle.length; k += 2) {
                double f = flow[cycle[k][0]][cycle[k][1]];
                if (f < theta) {
                    theta = f;
                    emptied = k;
                }
            }
            for (int k = 0; k < cycle.length; k++) {
                int[] e = cycle[k];
                flow[e[0]][e[1]] += (k % 2 == losing) ? -theta : theta;
                if (flow[e[0]][e[1]] < EPS) {
                    flow[e[0]][e[1]] = 0.0;
                }
            }
            flow[cycle[emptied][0]][cycle[emptied][1]] = 0.0;
            cancelled++;
        }
        return cancelled;
    }

    /**
     * Returns the edges (warehouse, store) of one support cycle, starting with the edge that
     * closed it and then walking the forest from its store end back to its warehouse end,
     * or null when the support is a forest.
     */
    private int[][] findSupportCycle(double[][] flow) {
        int warehouses = flow.length;
        int stores = warehouses == 0 ? 0 : flow[0].length;
        int nodes = warehouses + stores;
        int[] parent = new int[nodes];
        for (int i = 0; i < nodes; i++) parent[i] = i;
        List<List<int[]>> forest = new ArrayList<>(nodes);
        for (int i = 0; i < nodes; i++) forest.add(new ArrayList<>());

        for (int w = 0; w < warehouses; w++) {
            for (int s = 0; s < stores; s++) {
                if (flow[w][s] <= EPS) continue;
                int a = w;
                int b = warehouses + s;
                int ra = find(parent, a);
                int rb = find(parent, b);
                if (ra == rb) {
                    List<int[]> path = forestPath(forest, b, a, warehouses);
                    int[][] cycle = new int[path.size() + 1][];
                    cycle[0] = new int[]{w, s};
                    for (int k = 0; k < path.size(); k++) {
                        cycle[k + 1] = path.get(k);
                    }
                    return cycle;
                }
                parent[ra] = rb;
                forest.get(a).add(new int[]{b, w, s});
                forest.get(b).add(new int[]{a, w, s});
            }
        }
        return null;
    }

    private static List<int[]> forestPath(List<List<int[]>> forest, int from, int to, int warehouses) {
        int nodes = forest.size();
        int[] prevNode = new int[nodes];
        int[][] prevEdge = new int[nodes][];
        Arrays.fill(prevNode, -2);
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(from);
        prevNode[from] = -1;
        while (!queue.isEmpty()) {
            int u = queue.poll();
            if (u == to) break;
            for (int[] adj : forest.get(u)) {
                int v = adj[0];
                if (prevNode[v] == -2) {
                    prevNode[v] = u;
                    prevEdge[v] = new int[]{adj[1], adj[2]};
                    queue.add(v);
                }
            }
        }
        List<int[]> reversed = new ArrayList<>();
        for (int v = to; v != from; v = prevNode[v]) {
            reversed.add(prevEdge[v]);
        }
        List<int[]> path = new ArrayList<>(reversed.size());
        for (int k = reversed.size() - 1; k >= 0; k--) {
            path.add(reversed.get(k));
        }
        return path;
    }

    private static int find(int[] parent, int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    private static final class Edge {
        final int from;
        final int to;
        final double capacity;
        final double cost;
        double flow;
        Edge reverse;

        Edge(int from, int to, double capacity, double cost) {
            this.from = from;
            this.to = to;
            this.capacity = capacity;
            this.cost = cost;
        }

        double residual() {
            return capacity - flow;
        }
    }

    private static final class Network {
        private final List<List<Edge>> adjacency;

        Network(int nodes) {
            adjacency = new ArrayList<>(nodes);
            for (int i = 0; i < nodes; i++) {
                adjacency.add(new ArrayList<>());
            }
        }

        Edge addEdge(int from, int to, double capacity, double cost) {
            Edge forward = new Edge(from, to, capacity, cost);
            Edge backward = new Edge(to, from, 0.0, -cost);
            forward.reverse = backward;
            backward.reverse = forward;
            adjacency.get(from).add(forward);
            adjacency.get(to).add(backward);
            return forward;
        }

        /** Bellman-Ford (queue based); returns the incoming edge per node, or null if sink unreachable. */
        Edge[] cheapestPath(int source, int sink) {
            int n = adjacency.size();
            double[] dist = new double[n];
            Arrays.fill(dist, Double.POSITIVE_INFINITY);
            Edge[] via = new Edge[n];
            boolean[] queued = new boolean[n];
            Deque<Integer> queue = new ArrayDeque<>();
            dist[source] = 0.0;
            queue.add(source);
            queued[source] = true;
            while (!queue.isEmpty()) {
                int u = queue.poll();
                queued[u] = false;
                for (Edge e : adjacency.get(u)) {
                    if (e.residual() <= EPS) continue;
                    double candidate = dist[u] + e.cost;
                    if (candidate < dist[e.to] - COST_EPS) {
                        dist[e.to] = candidate;
                        via[e.to] = e;
                        if (!queued[e.to]) {
                            queued[e.to] = true;
                            queue.add(e.to);
                        }
                    }
                }
            }
            return dist[sink] == Double.POSITIVE_INFINITY ? null : via;
        }

        Edge[] shortestHopPath(int source, int sink) {
            int n = adjacency.size();
            Edge[] via = new Edge[n];
            boolean[] seen = new boolean[n];
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(source);
            seen[source] = true;
            while (!queue.isEmpty()) {
                int u = queue.poll();
                for (Edge e : adjacency.get(u)) {
                    if (e.residual() <= EPS || seen[e.to]) continue;
                    seen[e.to] = true;
                    via[e.to] = e;
                    if (e.to == sink) return via;
                    queue.add(e.to);
                }
            }
            return null;
        }

        double augment(Edge[] via, int source, int sink) {
            double bottleneck = Double.POSITIVE_INFINITY;
            for (int v = sink; v != source; v = via[v].from) {
                bottleneck = Math.min(bottleneck, via[v].residual());
            }
            for (int v = sink; v != source; v = via[v].from) {
                via[v].flow += bottleneck;
                via[v].reverse.flow -= bottleneck;
            }
            return bottleneck;
        }
    }
}

package com.supplyplanner.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.supplyplanner.exception.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Square matrix of pairwise travel values (kilometres or minutes) keyed by location id.
 * Rows and columns follow {@link #getLocationIds()}; the diagonal is zero and
 * {@link Double#POSITIVE_INFINITY} marks an impassable edge.
 * <p>
 * Instances are immutable: every mutator returns a new matrix.
 */
public final class TravelMatrix {

    private final List<String> locationIds;
    private final double[][] rows;
    private final Map<String, Integer> index;

    private TravelMatrix(List<String> locationIds, double[][] rows) {
        this.locationIds = List.copyOf(locationIds);
        this.rows = rows;
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < locationIds.size(); i++) {
            idx.put(locationIds.get(i), i);
        }
        this.index = Collections.unmodifiableMap(idx);
    }

    @JsonCreator
    public static TravelMatrix of(@JsonProperty("locationIds") List<String> locationIds,
                                  @JsonProperty("rows") double[][] rows) {
        List<String> problems = new ArrayList<>();
        if (locationIds == null || rows == null) {
            throw new ValidationException("travel matrix requires both locationIds and rows");
        }
        int n = locationIds.size();
        if (rows.length != n) {
            problems.add("travel matrix has " + rows.length + " rows for " + n + " location ids");
        }
        if (Set.copyOf(locationIds.stream().filter(id -> id != null).toList()).size() != n) {
            problems.add("travel matrix location ids must be non-null and unique");
        }
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i] == null || rows[i].length != n) {
                problems.add("travel matrix row " + i + " has "
                        + (rows[i] == null ? 0 : rows[i].length) + " entries, expected " + n);
                continue;
            }
            copy[i] = rows[i].clone();
            for (int j = 0; j < n; j++) {
                double v = copy[i][j];
                if (Double.isNaN(v) || v < 0 || v == Double.NEGATIVE_INFINITY) {
                    problems.add("travel matrix entry [" + i + "][" + j + "] is " + v);
                }
            }
            if (i < n && copy[i][i] != 0.0) {
                problems.add("travel matrix diagonal entry [" + i + "][" + i + "] must be 0");
            }
        }
        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }
        return new TravelMatrix(locationIds, copy);
    }

    public static TravelMatrix of(List<String> locationIds, List<List<Double>> rows) {
        double[][] values = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            List<Double> row = rows.get(i);
            values[i] = row == null ? null : row.stream().mapToDouble(Double::doubleValue).toArray();
        }
        return of(locationIds, values);
    }

    public List<String> getLocationIds() {
        return locationIds;
    }

    public double[][] getRows() {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }

    public int size() {
        return locationIds.size();
    }

    public boolean contains(String locationId) {
        return index.containsKey(locationId);
    }

    /** Position of the id in row order, or -1. */
    public int indexOf(String locationId) {
        Integer i = index.get(locationId);
        return i == null ? -1 : i;
    }

    public double get(int from, int to) {
        return rows[from][to];
    }

    public double get(String fromId, String toId) {
        int from = indexOf(fromId);
        int to = indexOf(toId);
        if (from < 0 || to < 0) {
            throw new IllegalArgumentException("Unknown location in travel lookup: " + fromId + " -> " + toId);
        }
        return rows[from][to];
    }

    public TravelMatrix withEdge(String fromId, String toId, double value) {
        int from = indexOf(fromId);
        int to = indexOf(toId);
        if (from < 0 || to < 0) {
            throw new IllegalArgumentException("Unknown location in travel edge: " + fromId + " -> " + toId);
        }
        double[][] copy = getRows();
        copy[from][to] = value;
        return new TravelMatrix(locationIds, copy);
    }

    /** Drops the rows and columns of the given ids. */
    public TravelMatrix without(Collection<String> removedIds) {
        if (removedIds.isEmpty()) {
            return this;
        }
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < locationIds.size(); i++) {
            if (!removedIds.contains(locationIds.get(i))) {
                kept.add(i);
            }
        }
        List<String> ids = kept.stream().map(locationIds::get).toList();
        double[][] values = new double[kept.size()][kept.size()];
        for (int i = 0; i < kept.size(); i++) {
            for (int j = 0; j < kept.size(); j++) {
                values[i][j] = rows[kept.get(i)][kept.get(j)];
            }
        }
        return new TravelMatrix(ids, values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TravelMatrix other)) return false;
        return locationIds.equals(other.locationIds) && Arrays.deepEquals(rows, other.rows);
    }

    @Override
    public int hashCode() {
        return 31 * locationIds.hashCode() + Arrays.deepHashCode(rows);
    }

    @Override
    public String toString() {
        return "TravelMatrix(" + locationIds.size() + "x" + locationIds.size() + ")";
    }
}

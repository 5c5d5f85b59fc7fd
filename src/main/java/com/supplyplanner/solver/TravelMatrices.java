package com.supplyplanner.solver;

import com.supplyplanner.domain.Location;
import com.supplyplanner.domain.TravelMatrix;
import com.supplyplanner.exception.ValidationException;

import java.util.List;

/**
 * Fallbacks for travel matrices the snapshot does not supply.
 */
public final class TravelMatrices {

    private static final double EARTH_RADIUS_KM = 6371.0;

    private TravelMatrices() {
    }

    /** Great-circle kilometres between every pair of locations. */
    public static TravelMatrix haversine(List<Location> locations) {
        int n = locations.size();
        double[][] rows = new double[n][n];
        for (int i = 0; i < n; i++) {
            Location from = locations.get(i);
            if (!from.hasCoordinates()) {
                throw new ValidationException("location '" + from.getId()
                        + "' has no coordinates and no distance matrix was supplied");
            }
            for (int j = 0; j < n; j++) {
                if (i == j) continue;
                Location to = locations.get(j);
                if (!to.hasCoordinates()) {
                    throw new ValidationException("location '" + to.getId()
                            + "' has no coordinates and no distance matrix was supplied");
                }
                rows[i][j] = haversineKm(from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude());
            }
        }
        return TravelMatrix.of(locations.stream().map(Location::getId).toList(), rows);
    }

    /** Minutes at a constant speed; impassable edges stay impassable. */
    public static TravelMatrix minutesAtSpeed(TravelMatrix distanceKm, double speedKmh) {
        double[][] rows = distanceKm.getRows();
        for (double[] row : rows) {
            for (int j = 0; j < row.length; j++) {
                row[j] = row[j] / speedKmh * 60.0;
            }
        }
        return TravelMatrix.of(distanceKm.getLocationIds(), rows);
    }

    static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return EARTH_RADIUS_KM * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }
}

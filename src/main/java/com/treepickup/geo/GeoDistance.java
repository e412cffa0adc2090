package com.treepickup.geo;

import com.treepickup.model.Coordinate;

/**
 * Great-circle distance on a spherical Earth (haversine formula)
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_KM = 6371.0;

    public static final double KM_TO_MILES = 0.621371;

    private GeoDistance() {
    }

    /**
     * Distance between two coordinates in kilometers. Identical coordinates
     * return exactly zero.
     */
    public static double distanceKm(Coordinate a, Coordinate b) {
        if (a.getLatitude() == b.getLatitude() && a.getLongitude() == b.getLongitude()) {
            return 0.0;
        }

        double lat1 = Math.toRadians(a.getLatitude());
        double lat2 = Math.toRadians(b.getLatitude());
        double deltaLat = Math.toRadians(b.getLatitude() - a.getLatitude());
        double deltaLon = Math.toRadians(b.getLongitude() - a.getLongitude());

        double sinLat = Math.sin(deltaLat / 2);
        double sinLon = Math.sin(deltaLon / 2);
        // Rounding can push h just past 1 for antipodal points
        double h = Math.min(1.0, sinLat * sinLat + Math.cos(lat1) * Math.cos(lat2) * sinLon * sinLon);

        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_KM * c;
    }

    public static double toMiles(double km) {
        return km * KM_TO_MILES;
    }
}

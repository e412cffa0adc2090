package com.treepickup.geo;

import com.treepickup.model.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.Point;

import java.util.Collection;

/**
 * Mean latitude / mean longitude of a set of coordinates.
 * Computed as the centroid of a JTS multipoint with x = longitude, y = latitude.
 */
public final class GeoCentroid {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private GeoCentroid() {
    }

    /**
     * @return the centroid, or null for an empty collection
     */
    public static Coordinate of(Collection<Coordinate> coordinates) {
        if (coordinates.isEmpty()) {
            return null;
        }

        org.locationtech.jts.geom.Coordinate[] points = new org.locationtech.jts.geom.Coordinate[coordinates.size()];
        int i = 0;
        for (Coordinate coordinate : coordinates) {
            points[i++] = new org.locationtech.jts.geom.Coordinate(coordinate.getLongitude(), coordinate.getLatitude());
        }

        MultiPoint multiPoint = GEOMETRY_FACTORY.createMultiPointFromCoords(points);
        Point centroid = multiPoint.getCentroid();
        return Coordinate.of(clamp(centroid.getY(), 90.0), clamp(centroid.getX(), 180.0));
    }

    // A mean of boundary values can round just past the valid range
    private static double clamp(double value, double bound) {
        return Math.max(-bound, Math.min(bound, value));
    }
}

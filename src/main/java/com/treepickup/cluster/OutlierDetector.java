package com.treepickup.cluster;

import com.treepickup.geo.GeoCentroid;
import com.treepickup.geo.GeoDistance;
import com.treepickup.model.Coordinate;
import com.treepickup.model.Location;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Distance checks that flag locations worth a second look
 */
@Component
public class OutlierDetector {

    /**
     * Single warning if any two locations in the team are further apart than
     * the threshold. Scanning stops at the first such pair.
     */
    public List<String> detectPairwiseOutliers(List<Location> locations, double thresholdKm) {
        List<String> warnings = new ArrayList<>();
        if (locations.size() <= 1) {
            return warnings;
        }

        for (int i = 0; i < locations.size(); i++) {
            for (int j = i + 1; j < locations.size(); j++) {
                double distance = GeoDistance.distanceKm(locations.get(i).getCoordinate(), locations.get(j).getCoordinate());
                if (distance > thresholdKm) {
                    warnings.add(String.format("Locations more than %.1f km (%.1f miles) apart detected",
                            thresholdKm, GeoDistance.toMiles(thresholdKm)));
                    return warnings;
                }
            }
        }
        return warnings;
    }

    /**
     * Locations further than the threshold from the centroid of the whole
     * set. Needs more than two locations to say anything.
     */
    public List<Location> detectGlobalOutliers(List<Location> locations, double thresholdKm) {
        if (locations.size() <= 2) {
            return new ArrayList<>();
        }

        Coordinate centroid = GeoCentroid.of(locations.stream()
                .map(Location::getCoordinate)
                .collect(Collectors.toList()));

        List<Location> outliers = new ArrayList<>();
        for (Location location : locations) {
            if (GeoDistance.distanceKm(location.getCoordinate(), centroid) > thresholdKm) {
                outliers.add(location);
            }
        }
        return outliers;
    }

    /**
     * Team-level warning when the spanning tree length is above the threshold
     */
    public Optional<String> compactnessWarning(double mstDistanceKm, double thresholdKm) {
        if (mstDistanceKm <= thresholdKm) {
            return Optional.empty();
        }
        return Optional.of(String.format("Estimated distance is %.2f km (%.2f miles) - verify locations are correct",
                mstDistanceKm, GeoDistance.toMiles(mstDistanceKm)));
    }
}

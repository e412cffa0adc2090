package com.treepickup.cluster;

import com.treepickup.model.Location;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.treepickup.LocationFixtures.at;
import static org.junit.jupiter.api.Assertions.*;

class OutlierDetectorTest {

    private final OutlierDetector detector = new OutlierDetector();

    // 0.1394 degrees of latitude is about 15.5 km
    private final Location north = at("n", 47.7394, -122.3);
    private final Location south = at("s", 47.6, -122.3);

    @Test
    void testPairBelowThresholdIsNotFlagged() {
        assertTrue(detector.detectPairwiseOutliers(List.of(north, south), 16.0).isEmpty());
    }

    @Test
    void testPairAboveThresholdIsFlagged() {
        List<String> warnings = detector.detectPairwiseOutliers(List.of(north, south), 15.0);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("apart"));
    }

    @Test
    void testOnlyOneWarningForManyFarPairs() {
        List<Location> spread = List.of(
                at("a", 47.0, -122.0), at("b", 47.5, -122.0), at("c", 48.0, -122.0), at("d", 48.5, -122.0));
        assertEquals(1, detector.detectPairwiseOutliers(spread, 16.0).size());
    }

    @Test
    void testSingleLocationHasNoPairs() {
        assertTrue(detector.detectPairwiseOutliers(List.of(north), 0.0).isEmpty());
        assertTrue(detector.detectPairwiseOutliers(List.of(), 0.0).isEmpty());
    }

    @Test
    void testGlobalOutlierFarFromCentroid() {
        List<Location> locations = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            locations.add(at("near-" + i, 47.6 + i * 0.001, -122.3));
        }
        Location spokane = at("spokane", 47.6588, -117.4260);
        locations.add(spokane);

        List<Location> outliers = detector.detectGlobalOutliers(locations, 50.0);
        assertEquals(List.of(spokane), outliers);
    }

    @Test
    void testGlobalCheckNeedsMoreThanTwoLocations() {
        Location spokane = at("spokane", 47.6588, -117.4260);
        assertTrue(detector.detectGlobalOutliers(List.of(south, spokane), 50.0).isEmpty());
    }

    @Test
    void testCompactnessWarningIncludesMiles() {
        assertEquals(Optional.empty(), detector.compactnessWarning(80.0, 80.0));

        Optional<String> warning = detector.compactnessWarning(100.0, 80.0);
        assertTrue(warning.isPresent());
        assertTrue(warning.get().contains("100.00 km"));
        assertTrue(warning.get().contains("62.14 miles"));
    }
}

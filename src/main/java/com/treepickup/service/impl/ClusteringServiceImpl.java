package com.treepickup.service.impl;

import com.treepickup.aspect.Timed;
import com.treepickup.cluster.Assignment;
import com.treepickup.cluster.CapacityRedistributor;
import com.treepickup.cluster.ColorAssigner;
import com.treepickup.cluster.KMeansPartitioner;
import com.treepickup.cluster.MinimumSpanningTreeMetric;
import com.treepickup.cluster.OutlierDetector;
import com.treepickup.config.ClusteringProperties;
import com.treepickup.exception.InvalidInputException;
import com.treepickup.geo.GeoCentroid;
import com.treepickup.geo.GeoDistance;
import com.treepickup.model.Coordinate;
import com.treepickup.model.Location;
import com.treepickup.model.PartitionRequest;
import com.treepickup.model.PartitionResult;
import com.treepickup.model.Team;
import com.treepickup.service.ClusteringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs partition, redistribution, metrics and coloring strictly in that
 * order. Holds no per-request state, so concurrent callers are safe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClusteringServiceImpl implements ClusteringService {

    private final KMeansPartitioner partitioner;
    private final CapacityRedistributor redistributor;
    private final MinimumSpanningTreeMetric mstMetric;
    private final OutlierDetector outlierDetector;
    private final ColorAssigner colorAssigner;
    private final ClusteringProperties properties;

    @Override
    @Timed(value = "partition", logLevel = Timed.LogLevel.INFO)
    public PartitionResult partition(PartitionRequest request) {
        List<Location> locations = request.getLocations();
        int numTeams = request.getNumTeams();
        validate(request);

        log.info("Partitioning {} locations into {} teams (capacity {}, seed {})",
                locations.size(), numTeams, request.getMaxTeamSize(), request.getSeed());

        List<String> globalWarnings = new ArrayList<>();

        ClusteringProperties.Outliers thresholds = properties.getOutliers();
        List<Location> globalOutliers = outlierDetector.detectGlobalOutliers(locations, thresholds.getGlobalThresholdKm());
        if (!globalOutliers.isEmpty()) {
            Coordinate center = centerOf(locations);
            for (Location outlier : globalOutliers) {
                globalWarnings.add(String.format(
                        "Location '%s' is %.1f km from the center of all locations - verify it is correct",
                        outlier.getId(), GeoDistance.distanceKm(outlier.getCoordinate(), center)));
            }
        }

        if (request.hasCapacityBound()) {
            capacityFillWarning(locations.size(), numTeams, request.getMaxTeamSize()).ifPresent(globalWarnings::add);
        }

        Assignment assignment = partitioner.partition(locations, numTeams, request.getSeed());

        int redistributionIterations = 0;
        if (request.hasCapacityBound()) {
            redistributionIterations = redistributor.redistribute(assignment, request.getMaxTeamSize());
            if (redistributionIterations > 0) {
                globalWarnings.add(String.format(
                        "Moved %d locations between teams to keep every team at or under %d locations; "
                                + "affected teams may be less compact",
                        redistributionIterations, request.getMaxTeamSize()));
            }
        }

        List<Team> teams = new ArrayList<>(numTeams);
        for (int index = 0; index < numTeams; index++) {
            teams.add(buildTeam(assignment, index, request.getTeamNames().get(index), thresholds));
        }

        globalWarnings.addAll(colorAssigner.assignColors(teams));

        log.info("Created {} teams with team sizes {} and {} global warnings",
                numTeams, Arrays.toString(assignment.sizes()), globalWarnings.size());

        return PartitionResult.builder()
                .teams(teams)
                .totalLocations(locations.size())
                .numTeams(numTeams)
                .globalWarnings(globalWarnings)
                .globalOutliers(globalOutliers)
                .redistributionIterations(redistributionIterations)
                .build();
    }

    private Team buildTeam(Assignment assignment, int index, String name, ClusteringProperties.Outliers thresholds) {
        List<Location> members = assignment.members(index);
        double mstDistance = mstMetric.totalDistanceKm(members);

        Team team = Team.builder()
                .index(index)
                .name(name)
                .locations(members)
                .centroid(assignment.centroid(index))
                .mstDistanceKm(mstDistance)
                .build();

        outlierDetector.detectPairwiseOutliers(members, thresholds.getPairThresholdKm()).forEach(team::addWarning);
        outlierDetector.compactnessWarning(mstDistance, thresholds.getCompactnessThresholdKm()).ifPresent(team::addWarning);

        log.debug("Team {} '{}': {} locations, MST {} km, {} warnings",
                index, name, members.size(), mstDistance, team.getWarnings().size());
        return team;
    }

    private void validate(PartitionRequest request) {
        List<Location> locations = request.getLocations();
        int numTeams = request.getNumTeams();

        if (locations.isEmpty()) {
            throw new InvalidInputException("At least one location is required");
        }
        if (numTeams < 1) {
            throw new InvalidInputException("Number of teams must be at least 1 but was " + numTeams);
        }
        if (numTeams > locations.size()) {
            throw new InvalidInputException(String.format(
                    "Cannot create %d teams with only %d locations. Reduce team count or add more locations.",
                    numTeams, locations.size()));
        }
        if (request.getTeamNames().size() < numTeams) {
            throw new InvalidInputException(String.format(
                    "Not enough team names: expected at least %d names but got %d",
                    numTeams, request.getTeamNames().size()));
        }
        if (request.hasCapacityBound() && request.getMaxTeamSize() < 1) {
            throw new InvalidInputException("Maximum team size must be at least 1 but was " + request.getMaxTeamSize());
        }

        Set<String> ids = new HashSet<>();
        for (Location location : locations) {
            if (location.getId() == null) {
                throw new InvalidInputException("Every location needs an id");
            }
            if (!ids.add(location.getId())) {
                throw new InvalidInputException("Duplicate location id '" + location.getId() + "'");
            }
            if (!location.hasCoordinate()) {
                throw new InvalidInputException("Location '" + location.getId()
                        + "' has no coordinate; geocode all locations before partitioning");
            }
        }
    }

    private Optional<String> capacityFillWarning(int numLocations, int numTeams, int capacity) {
        long totalCapacity = (long) numTeams * capacity;
        if (numLocations < properties.getCapacity().getSafeFillRatio() * totalCapacity) {
            return Optional.empty();
        }
        return Optional.of(String.format(
                "%d locations fill %.0f%% of the capacity of %d teams at %d locations each; "
                        + "teams may need rebalancing away from their natural areas",
                numLocations, 100.0 * numLocations / totalCapacity, numTeams, capacity));
    }

    private static Coordinate centerOf(List<Location> locations) {
        List<Coordinate> coordinates = new ArrayList<>(locations.size());
        for (Location location : locations) {
            coordinates.add(location.getCoordinate());
        }
        return GeoCentroid.of(coordinates);
    }
}

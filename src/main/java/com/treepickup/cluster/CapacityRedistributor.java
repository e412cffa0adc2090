package com.treepickup.cluster;

import com.treepickup.config.ClusteringProperties;
import com.treepickup.exception.CapacityException;
import com.treepickup.exception.CapacityException.Reason;
import com.treepickup.geo.GeoDistance;
import com.treepickup.model.Coordinate;
import com.treepickup.model.Location;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Brings every team to at most a fixed number of locations by moving single
 * locations out of the most overloaded team.
 *
 * Each step recomputes team centroids, takes the largest team above the bound
 * (lowest index on ties) and moves the one member closest to the centroid of a
 * team that still has room. A team with no members counts as distance zero so
 * empty teams are filled first. Equal distances are broken by location id and
 * then by target team index.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CapacityRedistributor {

    private final ClusteringProperties properties;

    /**
     * Redistribute in place.
     *
     * @return the number of moves made, zero if no team was over the bound
     * @throws CapacityException if the bound cannot be met
     */
    public int redistribute(Assignment assignment, int capacity) {
        int numTeams = assignment.numTeams();
        if (overloadedTeam(assignment, capacity) < 0) {
            return 0;
        }

        if (numTeams == 1) {
            log.warn("Single team holds {} locations with capacity {}", assignment.size(0), capacity);
            throw new CapacityException(Reason.SINGLE_TEAM_OVERLOAD, String.format(
                    "The only team has %d locations but capacity is %d and there is no other team to move them to",
                    assignment.size(0), capacity), capacity, assignment.size(0), 0);
        }

        boolean roomAnywhere = false;
        for (int team = 0; team < numTeams; team++) {
            if (assignment.size(team) < capacity) {
                roomAnywhere = true;
                break;
            }
        }
        if (!roomAnywhere) {
            log.warn("All {} teams are at or above capacity {}", numTeams, capacity);
            throw new CapacityException(Reason.ALL_TEAMS_FULL, String.format(
                    "All %d teams are at or above capacity %d; %d locations cannot fit",
                    numTeams, capacity, assignment.numLocations()),
                    capacity, assignment.largestTeamSize(), 0);
        }

        int maxIterations = properties.getRedistribution().getMaxIterations();
        int iterations = 0;
        int source;
        while ((source = overloadedTeam(assignment, capacity)) >= 0) {
            if (iterations >= maxIterations) {
                log.warn("Redistribution stopped after {} iterations with team {} at {} locations",
                        iterations, source, assignment.size(source));
                throw new CapacityException(Reason.ITERATION_LIMIT, String.format(
                        "Could not bring team %d from %d locations down to capacity %d within %d iterations",
                        source, assignment.size(source), capacity, maxIterations),
                        capacity, assignment.size(source), iterations);
            }
            iterations++;

            Coordinate[] centroids = new Coordinate[numTeams];
            for (int team = 0; team < numTeams; team++) {
                centroids[team] = assignment.centroid(team);
            }

            Move move = bestMove(assignment, source, centroids, capacity);
            if (move == null) {
                log.warn("No team has room for a location from team {} ({} locations, capacity {})",
                        source, assignment.size(source), capacity);
                throw new CapacityException(Reason.NO_CANDIDATE, String.format(
                        "Team %d still has %d locations but no other team is below capacity %d",
                        source, assignment.size(source), capacity),
                        capacity, assignment.size(source), iterations);
            }

            log.debug("Moving location '{}' from team {} to team {} ({} km from its centroid)",
                    assignment.getLocations().get(move.locationIndex).getId(), source, move.target, move.distanceKm);
            assignment.move(move.locationIndex, move.target);
        }

        log.info("Redistribution met capacity {} after {} iterations", capacity, iterations);
        return iterations;
    }

    /**
     * @return index of the largest team above capacity, or -1 if none
     */
    private static int overloadedTeam(Assignment assignment, int capacity) {
        int worst = -1;
        for (int team = 0; team < assignment.numTeams(); team++) {
            int size = assignment.size(team);
            if (size > capacity && (worst < 0 || size > assignment.size(worst))) {
                worst = team;
            }
        }
        return worst;
    }

    private static Move bestMove(Assignment assignment, int source, Coordinate[] centroids, int capacity) {
        Move best = null;
        for (int locationIndex : assignment.memberIndices(source)) {
            Location location = assignment.getLocations().get(locationIndex);
            for (int target = 0; target < assignment.numTeams(); target++) {
                if (target == source || assignment.size(target) >= capacity) {
                    continue;
                }
                double distance = assignment.size(target) == 0
                        ? 0.0
                        : GeoDistance.distanceKm(location.getCoordinate(), centroids[target]);
                Move candidate = new Move(locationIndex, location.getId(), target, distance);
                if (best == null || candidate.isBetterThan(best)) {
                    best = candidate;
                }
            }
        }
        return best;
    }

    private static final class Move {
        final int locationIndex;
        final String locationId;
        final int target;
        final double distanceKm;

        Move(int locationIndex, String locationId, int target, double distanceKm) {
            this.locationIndex = locationIndex;
            this.locationId = locationId;
            this.target = target;
            this.distanceKm = distanceKm;
        }

        boolean isBetterThan(Move other) {
            int byDistance = Double.compare(distanceKm, other.distanceKm);
            if (byDistance != 0) {
                return byDistance < 0;
            }
            int byId = locationId.compareTo(other.locationId);
            if (byId != 0) {
                return byId < 0;
            }
            return target < other.target;
        }
    }
}

package com.treepickup.cluster;

import com.treepickup.geo.GeoCentroid;
import com.treepickup.model.Coordinate;
import com.treepickup.model.Location;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Team membership for one request: the input locations in their original
 * order plus a team index per location. Moving a location between teams only
 * touches the index and the two team sizes.
 */
public class Assignment {

    private final List<Location> locations;
    private final int[] teamOf;
    private final int[] sizes;

    public Assignment(List<Location> locations, int[] teamOf, int numTeams) {
        if (teamOf.length != locations.size()) {
            throw new IllegalArgumentException("Expected " + locations.size()
                    + " team indices but got " + teamOf.length);
        }
        this.locations = Collections.unmodifiableList(new ArrayList<>(locations));
        this.teamOf = teamOf.clone();
        this.sizes = new int[numTeams];
        for (int team : this.teamOf) {
            if (team < 0 || team >= numTeams) {
                throw new IllegalArgumentException("Team index " + team + " outside [0, " + numTeams + ")");
            }
            sizes[team]++;
        }
    }

    public List<Location> getLocations() {
        return locations;
    }

    public int numLocations() {
        return locations.size();
    }

    public int numTeams() {
        return sizes.length;
    }

    public int teamOf(int locationIndex) {
        return teamOf[locationIndex];
    }

    public int[] teamIndices() {
        return teamOf.clone();
    }

    public int size(int team) {
        return sizes[team];
    }

    public int[] sizes() {
        return sizes.clone();
    }

    /**
     * Move one location to another team
     */
    public void move(int locationIndex, int targetTeam) {
        int source = teamOf[locationIndex];
        if (source == targetTeam) {
            return;
        }
        sizes[source]--;
        sizes[targetTeam]++;
        teamOf[locationIndex] = targetTeam;
    }

    /**
     * Location indices of a team, in input order
     */
    public List<Integer> memberIndices(int team) {
        List<Integer> members = new ArrayList<>(sizes[team]);
        for (int i = 0; i < teamOf.length; i++) {
            if (teamOf[i] == team) {
                members.add(i);
            }
        }
        return members;
    }

    public List<Location> members(int team) {
        List<Location> members = new ArrayList<>(sizes[team]);
        for (int i = 0; i < teamOf.length; i++) {
            if (teamOf[i] == team) {
                members.add(locations.get(i));
            }
        }
        return members;
    }

    /**
     * @return the team's centroid, or null if it has no members
     */
    public Coordinate centroid(int team) {
        List<Coordinate> coordinates = new ArrayList<>(sizes[team]);
        for (int i = 0; i < teamOf.length; i++) {
            if (teamOf[i] == team) {
                coordinates.add(locations.get(i).getCoordinate());
            }
        }
        return GeoCentroid.of(coordinates);
    }

    public int largestTeamSize() {
        return Arrays.stream(sizes).max().orElse(0);
    }

    @Override
    public String toString() {
        return "Assignment{locations=" + locations.size() + ", sizes=" + Arrays.toString(sizes) + "}";
    }
}

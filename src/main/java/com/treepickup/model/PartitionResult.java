package com.treepickup.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of a partitioning run: one team per requested index plus warnings
 * that apply to the whole run
 */
@Value
@Builder
public class PartitionResult {

    List<Team> teams;

    int totalLocations;

    int numTeams;

    List<String> globalWarnings;

    List<Location> globalOutliers;

    int redistributionIterations;
}

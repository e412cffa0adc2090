package com.treepickup.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Input to a single partitioning run
 */
@Value
@Builder
public class PartitionRequest {

    @Singular
    List<Location> locations;

    int numTeams;

    // Optional hard bound on locations per team
    Integer maxTeamSize;

    @Singular
    List<String> teamNames;

    @Builder.Default
    long seed = 42L;

    public boolean hasCapacityBound() {
        return maxTeamSize != null;
    }
}

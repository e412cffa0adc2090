package com.treepickup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Team - one balanced geographic group of locations
 * Annotated with its compactness distance, warnings and display color
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Team {

    private int index;
    private String name;
    private String color;

    @Builder.Default
    private List<Location> locations = new ArrayList<>();

    // Null when the team has no locations
    private Coordinate centroid;

    private double mstDistanceKm;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public int size() {
        return locations.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return locations.isEmpty();
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }
}

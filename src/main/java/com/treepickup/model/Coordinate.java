package com.treepickup.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.treepickup.exception.InvalidInputException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Geographic coordinate in decimal degrees
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Coordinate {

    double latitude;
    double longitude;

    /**
     * Create a coordinate, rejecting values outside [-90,90] / [-180,180]
     */
    @JsonCreator
    public static Coordinate of(@JsonProperty("latitude") double latitude,
                                @JsonProperty("longitude") double longitude) {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new InvalidInputException("Latitude must be between -90 and 90 but was " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new InvalidInputException("Longitude must be between -180 and 180 but was " + longitude);
        }
        return new Coordinate(latitude, longitude);
    }
}

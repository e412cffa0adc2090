package com.treepickup.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Map;

/**
 * A location to be assigned to a team. Identity is the id alone; the
 * coordinate may be missing when geocoding failed upstream, and the fields
 * are carried through clustering untouched.
 */
@Value
@Builder
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Location {

    @EqualsAndHashCode.Include
    String id;

    Coordinate coordinate;

    Map<String, Object> fields;

    public boolean hasCoordinate() {
        return coordinate != null;
    }
}

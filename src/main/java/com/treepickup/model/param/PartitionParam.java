package com.treepickup.model.param;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/partitions
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PartitionParam {

    private List<LocationParam> locations;

    private Integer teams;

    private Integer maxTeamSize;

    // Falls back to clustering.default-seed
    private Long seed;

    // Generated from the NATO alphabet when absent
    private List<String> teamNames;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LocationParam {
        private String id;
        // Both null means the location was not geocoded
        private Double lat;
        private Double lon;
        private Map<String, Object> fields;
    }
}

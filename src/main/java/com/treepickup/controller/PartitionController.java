package com.treepickup.controller;

import com.treepickup.aspect.TimingAspect;
import com.treepickup.cluster.TeamNameGenerator;
import com.treepickup.config.ClusteringProperties;
import com.treepickup.exception.ClusteringException;
import com.treepickup.exception.InvalidInputException;
import com.treepickup.model.Coordinate;
import com.treepickup.model.Location;
import com.treepickup.model.PartitionRequest;
import com.treepickup.model.PartitionResult;
import com.treepickup.model.param.PartitionParam;
import com.treepickup.model.result.ApiResponse;
import com.treepickup.service.ClusteringService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * HTTP REST API for team partitioning
 */
@RestController
@RequestMapping("/api/v1")
@Slf4j
public class PartitionController {

    // Team counts are bounded by location counts; this caps the standalone name listing
    static final int MAX_TEAM_NAMES = 10_000;

    @Autowired
    private ClusteringService clusteringService;

    @Autowired
    private TeamNameGenerator teamNameGenerator;

    @Autowired
    private ClusteringProperties properties;

    /**
     * HTTP: POST /api/v1/partitions
     */
    @PostMapping("/partitions")
    public ResponseEntity<ApiResponse<PartitionResult>> partition(@RequestBody PartitionParam param) {
        try {
            PartitionRequest request = toRequest(param);
            PartitionResult result = clusteringService.partition(request);
            return ResponseEntity.ok(ApiResponse.success(result, TimingAspect.getAndClearExecutionTime()));
        } catch (ClusteringException e) {
            TimingAspect.getAndClearExecutionTime();
            log.info("Rejected partition request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            TimingAspect.getAndClearExecutionTime();
            log.error("Error partitioning locations", e);
            return ResponseEntity.internalServerError().body(ApiResponse.error(e.getMessage()));
        }
    }

    /**
     * HTTP: GET /api/v1/team-names?count=N
     */
    @GetMapping("/team-names")
    public ResponseEntity<ApiResponse<List<String>>> teamNames(@RequestParam int count) {
        if (count < 0 || count > MAX_TEAM_NAMES) {
            return ResponseEntity.badRequest().body(ApiResponse.error(
                    "count must be between 0 and " + MAX_TEAM_NAMES + " but was " + count));
        }
        return ResponseEntity.ok(ApiResponse.success(teamNameGenerator.generate(count), "0ms"));
    }

    private PartitionRequest toRequest(PartitionParam param) {
        if (param.getTeams() == null) {
            throw new InvalidInputException("teams is required");
        }
        if (param.getLocations() == null || param.getLocations().isEmpty()) {
            throw new InvalidInputException("locations are required");
        }

        int numTeams = param.getTeams();
        if (numTeams < 1) {
            throw new InvalidInputException("Number of teams must be at least 1 but was " + numTeams);
        }
        if (numTeams > param.getLocations().size()) {
            throw new InvalidInputException(String.format(
                    "Cannot create %d teams with only %d locations. Reduce team count or add more locations.",
                    numTeams, param.getLocations().size()));
        }

        List<Location> locations = new ArrayList<>(param.getLocations().size());
        for (PartitionParam.LocationParam locationParam : param.getLocations()) {
            Coordinate coordinate = null;
            if (locationParam.getLat() != null && locationParam.getLon() != null) {
                coordinate = Coordinate.of(locationParam.getLat(), locationParam.getLon());
            } else if (locationParam.getLat() != null || locationParam.getLon() != null) {
                throw new InvalidInputException("Location '" + locationParam.getId() + "' needs both lat and lon");
            }
            locations.add(Location.builder()
                    .id(locationParam.getId())
                    .coordinate(coordinate)
                    .fields(locationParam.getFields())
                    .build());
        }

        List<String> teamNames = param.getTeamNames() != null
                ? param.getTeamNames()
                : teamNameGenerator.generate(numTeams);

        return PartitionRequest.builder()
                .locations(locations)
                .numTeams(numTeams)
                .maxTeamSize(param.getMaxTeamSize())
                .teamNames(teamNames)
                .seed(param.getSeed() != null ? param.getSeed() : properties.getDefaultSeed())
                .build();
    }
}

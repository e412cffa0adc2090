package com.treepickup.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.TestPropertySource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the partitioning HTTP API
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@TestPropertySource(properties = {"server.port=0"})
public class PartitionIntegrationTest {

    @LocalServerPort
    private int port;

    private TestRestTemplate restTemplate;
    private String baseUrl;

    @BeforeEach
    public void setUp() {
        restTemplate = new TestRestTemplate();
        baseUrl = "http://localhost:" + port + "/api/v1";
    }

    private static List<Map<String, Object>> grid(int count) {
        List<Map<String, Object>> locations = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Map<String, Object> location = new HashMap<>();
            location.put("id", "loc-" + i);
            location.put("lat", 47.55 + (i / 5) * 0.01);
            location.put("lon", -122.35 + (i % 5) * 0.013);
            location.put("fields", Map.of("address", i + " Pine St"));
            locations.add(location);
        }
        return locations;
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testPartitionWithCapacity() {
        Map<String, Object> request = new HashMap<>();
        request.put("locations", grid(20));
        request.put("teams", 3);
        request.put("maxTeamSize", 8);
        request.put("seed", 42);

        ResponseEntity<Map> response = restTemplate.postForEntity(baseUrl + "/partitions", request, Map.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue((Boolean) response.getBody().get("ok"));

        Map<String, Object> data = (Map<String, Object>) response.getBody().get("data");
        assertEquals(20, data.get("totalLocations"));

        List<Map<String, Object>> teams = (List<Map<String, Object>>) data.get("teams");
        assertEquals(3, teams.size());
        assertEquals("Team Alpha", teams.get(0).get("name"));
        assertEquals("red", teams.get(0).get("color"));

        int total = 0;
        for (Map<String, Object> team : teams) {
            List<Map<String, Object>> members = (List<Map<String, Object>>) team.get("locations");
            assertTrue(members.size() <= 8);
            total += members.size();
        }
        assertEquals(20, total);

        Map<String, Object> first = ((List<Map<String, Object>>) teams.get(0).get("locations")).get(0);
        assertTrue(((String) ((Map<String, Object>) first.get("fields")).get("address")).endsWith("Pine St"));
    }

    @Test
    public void testTooManyTeamsIsRejected() {
        Map<String, Object> request = new HashMap<>();
        request.put("locations", grid(3));
        request.put("teams", 5);

        ResponseEntity<Map> response = restTemplate.postForEntity(baseUrl + "/partitions", request, Map.class);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertFalse((Boolean) response.getBody().get("ok"));
        assertTrue(((String) response.getBody().get("error")).contains("5 teams"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testTeamNames() {
        ResponseEntity<Map> response = restTemplate.getForEntity(baseUrl + "/team-names?count=3", Map.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(List.of("Team Alpha", "Team Bravo", "Team Charlie"), response.getBody().get("data"));
    }
}

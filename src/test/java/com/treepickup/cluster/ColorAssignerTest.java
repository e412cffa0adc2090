package com.treepickup.cluster;

import com.treepickup.config.ClusteringProperties;
import com.treepickup.model.Coordinate;
import com.treepickup.model.Team;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColorAssignerTest {

    private ClusteringProperties properties;
    private ColorAssigner colorAssigner;

    @BeforeEach
    void setUp() {
        properties = new ClusteringProperties();
        colorAssigner = new ColorAssigner(properties);
    }

    private static Team teamAt(int index, double lat, double lon) {
        return Team.builder()
                .index(index)
                .name("Team " + index)
                .centroid(Coordinate.of(lat, lon))
                .build();
    }

    private static List<Team> teamsAlongMeridian(int count) {
        List<Team> teams = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            teams.add(teamAt(i, 47.0 + i * 0.1, -122.0));
        }
        return teams;
    }

    @Test
    void testFewerTeamsThanColorsUsesPaletteInOrder() {
        List<Team> teams = teamsAlongMeridian(3);

        List<String> warnings = colorAssigner.assignColors(teams);

        assertTrue(warnings.isEmpty());
        assertEquals("red", teams.get(0).getColor());
        assertEquals("green", teams.get(1).getColor());
        assertEquals("blue", teams.get(2).getColor());
    }

    @Test
    void testMoreTeamsThanColorsWarnsAndColorsEveryTeam() {
        assertEquals(12, properties.getColors().getPalette().size());
        List<Team> teams = teamsAlongMeridian(15);

        List<String> warnings = colorAssigner.assignColors(teams);

        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("15 teams"));
        for (Team team : teams) {
            assertNotNull(team.getColor());
            assertTrue(properties.getColors().getPalette().contains(team.getColor()));
        }
    }

    @Test
    void testReusedColorGoesToFurthestHolder() {
        properties.getColors().setPalette(List.of("red", "blue"));
        List<Team> teams = List.of(
                teamAt(0, 47.0, -122.0),
                teamAt(1, 48.0, -122.0),
                teamAt(2, 47.9, -122.0));

        colorAssigner.assignColors(teams);

        assertEquals("red", teams.get(2).getColor());
    }

    @Test
    void testEqualSeparationPrefersEarlierColor() {
        properties.getColors().setPalette(List.of("red", "blue"));
        List<Team> teams = List.of(
                teamAt(0, 47.0, -122.0),
                teamAt(1, 49.0, -122.0),
                teamAt(2, 48.0, -122.0));

        colorAssigner.assignColors(teams);

        // 48.0 is equidistant from 47.0 and 49.0 along the meridian
        assertEquals("red", teams.get(2).getColor());
    }

    @Test
    void testEmptyTeamGetsRoundRobinColor() {
        properties.getColors().setPalette(List.of("red", "blue"));
        Team empty = Team.builder().index(3).name("Team 3").build();
        List<Team> teams = List.of(
                teamAt(0, 47.0, -122.0),
                teamAt(1, 48.0, -122.0),
                teamAt(2, 47.1, -122.0),
                empty);

        colorAssigner.assignColors(teams);

        assertEquals("blue", teams.get(2).getColor());
        assertEquals("blue", empty.getColor());
    }
}

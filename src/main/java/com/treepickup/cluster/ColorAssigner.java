package com.treepickup.cluster;

import com.treepickup.config.ClusteringProperties;
import com.treepickup.geo.GeoDistance;
import com.treepickup.model.Team;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns palette colors to teams in index order. Once the palette runs out,
 * each further team takes the color whose nearest existing holder is
 * furthest from the team's centroid, so reused colors end up far apart.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ColorAssigner {

    private final ClusteringProperties properties;

    /**
     * Set the color of every team. Teams must already carry their centroids.
     *
     * @return global warnings, one if the palette is smaller than the team count
     */
    public List<String> assignColors(List<Team> teams) {
        List<String> palette = properties.getColors().getPalette();
        if (palette == null || palette.isEmpty()) {
            throw new IllegalStateException("clustering.colors.palette must contain at least one color");
        }

        List<String> warnings = new ArrayList<>();
        int directCount = Math.min(teams.size(), palette.size());
        for (int i = 0; i < directCount; i++) {
            teams.get(i).setColor(palette.get(i));
        }
        if (teams.size() <= palette.size()) {
            return warnings;
        }

        for (int i = palette.size(); i < teams.size(); i++) {
            Team team = teams.get(i);
            if (team.getCentroid() == null) {
                team.setColor(palette.get(i % palette.size()));
                continue;
            }
            team.setColor(furthestColor(team, teams.subList(0, i), palette));
        }

        log.debug("Reused colors for {} teams beyond a palette of {}", teams.size() - palette.size(), palette.size());
        warnings.add(String.format(
                "%d teams but only %d distinct colors; colors are reused for teams that are far apart",
                teams.size(), palette.size()));
        return warnings;
    }

    // First palette entry wins ties; a color no placed team with a centroid holds scores infinity
    private static String furthestColor(Team team, List<Team> placed, List<String> palette) {
        String best = palette.get(0);
        double bestSeparation = Double.NEGATIVE_INFINITY;
        for (String color : palette) {
            double separation = Double.POSITIVE_INFINITY;
            for (Team other : placed) {
                if (color.equals(other.getColor()) && other.getCentroid() != null) {
                    separation = Math.min(separation, GeoDistance.distanceKm(team.getCentroid(), other.getCentroid()));
                }
            }
            if (separation > bestSeparation) {
                bestSeparation = separation;
                best = color;
            }
        }
        return best;
    }
}

package com.treepickup.cluster;

import com.treepickup.exception.InvalidInputException;
import com.treepickup.geo.GeoDistance;
import com.treepickup.model.Coordinate;
import com.treepickup.model.Location;
import org.jgrapht.Graph;
import org.jgrapht.alg.spanning.KruskalMinimumSpanningTree;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.jgrapht.graph.SimpleWeightedGraph;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Compactness of a team as the total edge weight of a minimum spanning tree
 * over its locations, with great-circle distance as edge weight. The tree is
 * built with Kruskal over the complete graph of the team.
 */
@Component
public class MinimumSpanningTreeMetric {

    /**
     * @return total MST length in kilometers; 0 for fewer than two locations
     * @throws InvalidInputException if any location has no coordinate
     */
    public double totalDistanceKm(List<Location> locations) {
        int n = locations.size();
        if (n <= 1) {
            return 0.0;
        }

        Coordinate[] coordinates = new Coordinate[n];
        for (int i = 0; i < n; i++) {
            Location location = locations.get(i);
            if (!location.hasCoordinate()) {
                throw new InvalidInputException("Location '" + location.getId()
                        + "' is missing coordinates. All locations must be geocoded before distance calculation.");
            }
            coordinates[i] = location.getCoordinate();
        }

        if (n == 2) {
            return GeoDistance.distanceKm(coordinates[0], coordinates[1]);
        }

        Graph<Integer, DefaultWeightedEdge> graph = new SimpleWeightedGraph<>(DefaultWeightedEdge.class);
        for (int i = 0; i < n; i++) {
            graph.addVertex(i);
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                DefaultWeightedEdge edge = graph.addEdge(i, j);
                graph.setEdgeWeight(edge, GeoDistance.distanceKm(coordinates[i], coordinates[j]));
            }
        }
        return new KruskalMinimumSpanningTree<>(graph).getSpanningTree().getWeight();
    }
}

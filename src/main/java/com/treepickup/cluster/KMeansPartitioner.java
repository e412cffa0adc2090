package com.treepickup.cluster;

import com.treepickup.config.ClusteringProperties;
import com.treepickup.exception.InvalidInputException;
import com.treepickup.model.Location;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * K-Means partitioning of locations into a fixed number of teams.
 *
 * Latitude and longitude are treated as planar x/y with no projection, so
 * results degrade near the poles and across the antimeridian. Several
 * k-means++ initializations are run from a random source seeded per call and
 * the lowest-inertia result wins, so identical input and seed always give the
 * same assignment.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KMeansPartitioner {

    static final int MIN_INITIALIZATIONS = 10;

    private final ClusteringProperties properties;

    /**
     * Partition locations into numTeams teams. Teams may come back empty when
     * there are fewer distinct positions than teams.
     *
     * @throws InvalidInputException if numTeams is below 1 or above the location count
     */
    public Assignment partition(List<Location> locations, int numTeams, long seed) {
        int n = locations.size();
        if (numTeams < 1) {
            throw new InvalidInputException("Number of teams must be at least 1 but was " + numTeams);
        }
        if (numTeams > n) {
            throw new InvalidInputException(String.format(
                    "Cannot create %d teams with only %d locations. Reduce team count or add more locations.",
                    numTeams, n));
        }

        double[][] points = new double[n][];
        for (int i = 0; i < n; i++) {
            Location location = locations.get(i);
            if (!location.hasCoordinate()) {
                throw new InvalidInputException("Location '" + location.getId() + "' has no coordinate");
            }
            points[i] = new double[]{location.getCoordinate().getLatitude(), location.getCoordinate().getLongitude()};
        }

        int initializations = Math.max(MIN_INITIALIZATIONS, properties.getKmeans().getInitializations());
        int maxIterations = properties.getKmeans().getMaxIterations();
        Random random = new Random(seed);

        int[] bestLabels = null;
        double bestInertia = Double.POSITIVE_INFINITY;
        for (int run = 0; run < initializations; run++) {
            double[][] centroids = initialCentroids(points, numTeams, random);
            int[] labels = new int[n];
            Arrays.fill(labels, -1);

            int iterations = lloyd(points, centroids, labels, maxIterations);
            double inertia = inertia(points, centroids, labels);
            log.debug("K-Means run {} converged after {} iterations with inertia {}", run, iterations, inertia);

            if (inertia < bestInertia) {
                bestInertia = inertia;
                bestLabels = labels;
            }
        }

        log.debug("Selected K-Means partition with inertia {} for {} locations into {} teams",
                bestInertia, n, numTeams);
        return new Assignment(locations, bestLabels, numTeams);
    }

    /**
     * k-means++ seeding: first centroid uniform, each next one drawn with
     * probability proportional to squared distance from the nearest chosen one
     */
    private double[][] initialCentroids(double[][] points, int k, Random random) {
        int n = points.length;
        double[][] centroids = new double[k][];
        centroids[0] = points[random.nextInt(n)].clone();

        double[] nearest = new double[n];
        for (int i = 0; i < n; i++) {
            nearest[i] = squaredDistance(points[i], centroids[0]);
        }

        for (int c = 1; c < k; c++) {
            double total = 0.0;
            for (double d : nearest) {
                total += d;
            }

            int chosen;
            if (total == 0.0) {
                // Every point already coincides with a centroid
                chosen = random.nextInt(n);
            } else {
                double target = random.nextDouble() * total;
                chosen = n - 1;
                double cumulative = 0.0;
                for (int i = 0; i < n; i++) {
                    cumulative += nearest[i];
                    if (cumulative > target) {
                        chosen = i;
                        break;
                    }
                }
            }

            centroids[c] = points[chosen].clone();
            for (int i = 0; i < n; i++) {
                nearest[i] = Math.min(nearest[i], squaredDistance(points[i], centroids[c]));
            }
        }
        return centroids;
    }

    /**
     * Alternate assignment and update steps until no label changes.
     * Updates labels and centroids in place.
     *
     * @return iterations performed
     */
    private int lloyd(double[][] points, double[][] centroids, int[] labels, int maxIterations) {
        int k = centroids.length;
        int iteration = 0;
        boolean changed = true;

        while (changed && iteration < maxIterations) {
            iteration++;
            changed = false;

            for (int i = 0; i < points.length; i++) {
                int nearest = nearestCentroid(points[i], centroids);
                if (nearest != labels[i]) {
                    labels[i] = nearest;
                    changed = true;
                }
            }

            double[][] sums = new double[k][2];
            int[] counts = new int[k];
            for (int i = 0; i < points.length; i++) {
                sums[labels[i]][0] += points[i][0];
                sums[labels[i]][1] += points[i][1];
                counts[labels[i]]++;
            }
            for (int c = 0; c < k; c++) {
                // An empty cluster keeps its previous centroid
                if (counts[c] > 0) {
                    centroids[c][0] = sums[c][0] / counts[c];
                    centroids[c][1] = sums[c][1] / counts[c];
                }
            }
        }
        return iteration;
    }

    // Ties go to the lower index
    private static int nearestCentroid(double[] point, double[][] centroids) {
        int best = 0;
        double bestDistance = squaredDistance(point, centroids[0]);
        for (int c = 1; c < centroids.length; c++) {
            double d = squaredDistance(point, centroids[c]);
            if (d < bestDistance) {
                bestDistance = d;
                best = c;
            }
        }
        return best;
    }

    private static double inertia(double[][] points, double[][] centroids, int[] labels) {
        double sum = 0.0;
        for (int i = 0; i < points.length; i++) {
            sum += squaredDistance(points[i], centroids[labels[i]]);
        }
        return sum;
    }

    private static double squaredDistance(double[] a, double[] b) {
        double dx = a[0] - b[0];
        double dy = a[1] - b[1];
        return dx * dx + dy * dy;
    }
}

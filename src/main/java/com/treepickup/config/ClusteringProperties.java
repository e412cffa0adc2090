package com.treepickup.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for partitioning, bound from clustering.* properties
 */
@Data
@ConfigurationProperties(prefix = "clustering")
public class ClusteringProperties {

    private long defaultSeed = 42L;

    private KMeans kmeans = new KMeans();

    private Redistribution redistribution = new Redistribution();

    private Outliers outliers = new Outliers();

    private Capacity capacity = new Capacity();

    private Colors colors = new Colors();

    @Data
    public static class KMeans {
        /**
         * Independent random initializations per run; values below 10 are raised to 10
         */
        private int initializations = 10;
        private int maxIterations = 300;
    }

    @Data
    public static class Redistribution {
        private int maxIterations = 1000;
    }

    @Data
    public static class Outliers {
        private double pairThresholdKm = 16.0;
        private double globalThresholdKm = 50.0;
        private double compactnessThresholdKm = 80.0;
    }

    @Data
    public static class Capacity {
        /**
         * Fraction of total team capacity above which a fill warning is emitted
         */
        private double safeFillRatio = 0.8;
    }

    @Data
    public static class Colors {
        private List<String> palette = new ArrayList<>(List.of(
                "red", "green", "blue", "yellow", "magenta", "cyan",
                "bright_red", "bright_green", "bright_blue",
                "bright_yellow", "bright_magenta", "bright_cyan"));
    }
}

package com.treepickup.service;

import com.treepickup.model.PartitionRequest;
import com.treepickup.model.PartitionResult;

/**
 * Partitions geocoded locations into balanced geographic teams
 */
public interface ClusteringService {

    /**
     * Run the full pipeline: K-Means, capacity redistribution, per-team
     * compactness and outlier checks, color assignment.
     *
     * @throws com.treepickup.exception.InvalidInputException if the request is malformed
     * @throws com.treepickup.exception.CapacityException if the capacity bound cannot be met
     */
    PartitionResult partition(PartitionRequest request);
}

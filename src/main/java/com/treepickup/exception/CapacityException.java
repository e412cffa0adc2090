package com.treepickup.exception;

import lombok.Getter;

/**
 * Exception thrown when teams cannot be brought under the capacity bound.
 * Carries the bound and the size that could not be fixed so callers can
 * retry with a larger bound or more teams.
 */
@Getter
public class CapacityException extends ClusteringException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        SINGLE_TEAM_OVERLOAD,
        ALL_TEAMS_FULL,
        NO_CANDIDATE,
        ITERATION_LIMIT
    }

    private final Reason reason;
    private final int capacity;
    private final int teamSize;
    private final int iterations;

    public CapacityException(Reason reason, String message, int capacity, int teamSize, int iterations) {
        super(message + ". Increase the maximum team size or the number of teams.");
        this.reason = reason;
        this.capacity = capacity;
        this.teamSize = teamSize;
        this.iterations = iterations;
    }
}

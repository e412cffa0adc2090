package com.treepickup.exception;

/**
 * Base type for errors that abort a partitioning request
 */
public abstract class ClusteringException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected ClusteringException(String message) {
        super(message);
    }

    protected ClusteringException(String message, Throwable cause) {
        super(message, cause);
    }
}

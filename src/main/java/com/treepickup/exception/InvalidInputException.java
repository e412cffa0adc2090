package com.treepickup.exception;

/**
 * Exception thrown when a request cannot be partitioned as given
 */
public class InvalidInputException extends ClusteringException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }
}

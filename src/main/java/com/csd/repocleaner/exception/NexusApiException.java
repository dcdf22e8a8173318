package com.csd.repocleaner.exception;

/**
 * Nexus could not be reached or answered with something unusable.
 */
public class NexusApiException extends RuntimeException {

    public NexusApiException(String message) {
        super(message);
    }

    public NexusApiException(String message, Throwable cause) {
        super(message, cause);
    }
}

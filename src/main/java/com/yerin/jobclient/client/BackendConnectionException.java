package com.yerin.jobclient.client;

/**
 * Thrown when a client cannot be built because its backend is unreachable.
 * No client instance exists after this is raised.
 */
public class BackendConnectionException extends RuntimeException {

    public BackendConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}

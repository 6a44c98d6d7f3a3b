package com.yerin.jobclient.domain;

/**
 * The backend refused an operation because of the job's current state.
 */
public class InvalidJobOperationException extends RuntimeException {

    public InvalidJobOperationException(String message) {
        super(message);
    }
}

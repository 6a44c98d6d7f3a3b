package com.yerin.jobclient.domain;

/**
 * The caller's own input was rejected before it reached the backend: a blank
 * function reference, a non-positive timeout, arguments that cannot be stored,
 * or a malformed job id.
 */
public class InvalidJobRequestException extends IllegalArgumentException {

    public InvalidJobRequestException(String message) {
        super(message);
    }

    public InvalidJobRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.yerin.jobclient.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum JobStatus {
    QUEUED("queued"),
    STARTED("started"),
    FINISHED("finished"),
    FAILED("failed"),
    CANCELED("canceled");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == FINISHED || this == FAILED || this == CANCELED;
    }

    public static Optional<JobStatus> fromValue(String value) {
        for (JobStatus s : values()) {
            if (s.value.equals(value)) return Optional.of(s);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}

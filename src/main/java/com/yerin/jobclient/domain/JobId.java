package com.yerin.jobclient.domain;

import java.util.regex.Pattern;

/**
 * Opaque job identifier issued by the backend at enqueue time.
 * Callers must not interpret its content.
 */
public record JobId(String value) {

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    public JobId {
        if (value == null || !ALLOWED.matcher(value).matches()) {
            throw new InvalidJobRequestException("malformed job id: " + value);
        }
    }

    public static JobId of(String value) {
        return new JobId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.yerin.jobclient.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a job as stored by the backend at the time of the fetch.
 * Never mutated by the client.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@AllArgsConstructor
public class JobRecord {

    private final JobId id;

    /** Raw status string as written by the backend or a worker. */
    private final String status;

    private final String origin;
    private final String functionRef;

    @Singular
    private final List<Object> args;

    @Singular
    private final Map<String, Object> kwargs;

    private final String description;
    private final Duration timeout;

    private final Instant createdAt;
    private final Instant enqueuedAt;
    private final Instant startedAt;
    private final Instant endedAt;

    @Singular("metaEntry")
    private final Map<String, Object> meta;

    /** Decoded result; {@code null} both when none was written and when JSON null was stored. */
    private final Object result;

    private final String excInfo;
}

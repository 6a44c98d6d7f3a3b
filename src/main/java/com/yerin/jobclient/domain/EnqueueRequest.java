package com.yerin.jobclient.domain;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A deferred invocation as handed to the backend: which function the worker
 * should resolve, with which arguments, and how long it may run.
 */
public record EnqueueRequest(
        String functionRef,
        List<Object> args,
        Map<String, Object> kwargs,
        Duration timeout
) {
    public EnqueueRequest {
        if (functionRef == null || functionRef.isBlank()) {
            throw new InvalidJobRequestException("function reference must not be blank");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new InvalidJobRequestException("timeout must be positive: " + timeout);
        }
        // null 인자는 허용 (워커 쪽에서 None/null 로 전달)
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    /** Renders the call as {@code func(1, 'a', key=value)}. */
    public String description() {
        Stream<String> positional = args.stream().map(EnqueueRequest::repr);
        Stream<String> named = kwargs.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + repr(e.getValue()));
        return functionRef + Stream.concat(positional, named)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    private static String repr(Object v) {
        return v instanceof CharSequence ? "'" + v + "'" : String.valueOf(v);
    }
}

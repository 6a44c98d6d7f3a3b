package com.yerin.jobclient.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class JobClientMetrics {

    private final MeterRegistry registry;

    private final Counter jobEnqueued;
    private final Counter jobCanceled;

    public JobClientMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobEnqueued = Counter.builder("jobclient_jobs_enqueued_total")
                .description("jobs accepted by the backend").register(registry);
        this.jobCanceled = Counter.builder("jobclient_jobs_canceled_total")
                .description("cancel requests accepted by the backend").register(registry);
    }

    public void incEnqueued() { jobEnqueued.increment(); }
    public void incCanceled() { jobCanceled.increment(); }

    // operation 태그별 실패 카운터
    public void incFailure(String operation) {
        Counter.builder("jobclient_operation_failures_total")
                .description("operations answered with an error result")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public Timer operationTimer(String operation) {
        return Timer.builder("jobclient_operation_duration_seconds")
                .description("backend round trip duration by operation")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}

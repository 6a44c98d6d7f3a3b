package com.yerin.jobclient.infra;

import com.yerin.jobclient.domain.EnqueueRequest;
import com.yerin.jobclient.domain.InvalidJobOperationException;
import com.yerin.jobclient.domain.JobId;
import com.yerin.jobclient.domain.JobQueuePort;
import com.yerin.jobclient.domain.JobRecord;
import com.yerin.jobclient.domain.JobStatus;
import com.yerin.jobclient.domain.NoSuchJobException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Process-local backend for running without Redis. There is no worker behind it:
 * jobs stay {@code queued} until they are canceled.
 */
@Slf4j
public class InMemoryJobQueueAdapter implements JobQueuePort {

    private final Map<JobId, JobRecord> jobs = new ConcurrentHashMap<>();
    private final Map<String, Queue<JobId>> queues = new ConcurrentHashMap<>();

    @Override
    public void ping() {
    }

    @Override
    public JobId enqueue(String queue, EnqueueRequest request) {
        JobId jobId = JobId.of(UUID.randomUUID().toString());
        Instant now = Instant.now();
        jobs.put(jobId, JobRecord.builder()
                .id(jobId)
                .status(JobStatus.QUEUED.value())
                .origin(queue)
                .functionRef(request.functionRef())
                .args(request.args())
                .kwargs(request.kwargs())
                .description(request.description())
                .timeout(request.timeout())
                .createdAt(now)
                .enqueuedAt(now)
                .build());
        queues.computeIfAbsent(queue, q -> new ConcurrentLinkedQueue<>()).add(jobId);
        log.info("[InMemoryQueue] enqueue queue={}, jobId={}, func={}", queue, jobId, request.functionRef());
        return jobId;
    }

    @Override
    public JobRecord fetch(JobId jobId) {
        JobRecord job = jobs.get(jobId);
        if (job == null) throw new NoSuchJobException(jobId);
        return job;
    }

    @Override
    public void cancel(String queue, JobId jobId) {
        JobRecord updated = jobs.compute(jobId, (id, job) -> {
            if (job == null) throw new NoSuchJobException(id);
            JobStatus.fromValue(job.getStatus())
                    .filter(JobStatus::isTerminal)
                    .ifPresent(s -> {
                        throw new InvalidJobOperationException("Cannot cancel job in terminal state: " + s.value());
                    });
            return job.toBuilder()
                    .status(JobStatus.CANCELED.value())
                    .endedAt(Instant.now())
                    .build();
        });
        String origin = updated.getOrigin() == null ? queue : updated.getOrigin();
        Queue<JobId> q = queues.get(origin);
        if (q != null) q.remove(jobId);
        log.info("[InMemoryQueue] canceled jobId={}, origin={}, status={}", jobId, origin, updated.getStatus());
    }

    @Override
    public long queueLength(String queue) {
        Queue<JobId> q = queues.get(queue);
        return q == null ? 0L : q.size();
    }
}

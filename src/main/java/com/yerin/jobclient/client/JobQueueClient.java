package com.yerin.jobclient.client;

import com.yerin.jobclient.domain.EnqueueRequest;
import com.yerin.jobclient.domain.InvalidJobOperationException;
import com.yerin.jobclient.domain.InvalidJobRequestException;
import com.yerin.jobclient.domain.JobClientMetrics;
import com.yerin.jobclient.domain.JobId;
import com.yerin.jobclient.domain.JobQueuePort;
import com.yerin.jobclient.domain.JobRecord;
import com.yerin.jobclient.domain.JobStatus;
import com.yerin.jobclient.domain.NoSuchJobException;
import com.yerin.jobclient.global.exception.code.JobErrorCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Submits deferred work to a job queue backend and observes the jobs it created.
 *
 * <p>Every operation performs one round trip to the backend and blocks until it
 * completes. Failures are reported as {@link Result.Err}; only the constructor
 * throws, when the backend cannot be reached at all.
 *
 * <p>Instances are safe for concurrent use as long as the underlying
 * {@link JobQueuePort} is.
 */
@Slf4j
public class JobQueueClient implements AutoCloseable {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofHours(1);

    private final JobQueuePort backend;
    @Getter
    private final String queueName;
    @Getter
    private final Duration defaultTimeout;
    private final JobClientMetrics metrics;
    private final AutoCloseable ownedConnection;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JobQueueClient(JobQueuePort backend, String queueName, Duration defaultTimeout,
                          JobClientMetrics metrics) {
        this(backend, queueName, defaultTimeout, metrics, null);
    }

    /**
     * @param ownedConnection released by {@link #close()}, or {@code null} when the
     *                        connection's lifecycle is managed elsewhere
     * @throws BackendConnectionException if the backend does not answer a ping
     */
    public JobQueueClient(JobQueuePort backend, String queueName, Duration defaultTimeout,
                          JobClientMetrics metrics, AutoCloseable ownedConnection) {
        this.backend = backend;
        this.queueName = queueName;
        this.defaultTimeout = defaultTimeout;
        this.metrics = metrics;
        this.ownedConnection = ownedConnection;

        try {
            backend.ping();
        } catch (Exception e) {
            log.error("[JobQueueClient] backend unreachable queue={}, cause={}", queueName, e.toString());
            BackendConnectionException fatal =
                    new BackendConnectionException("Failed to connect to Redis: " + messageOf(e), e);
            releaseConnection(fatal);
            throw fatal;
        }
        log.info("[JobQueueClient] connected queue={}, defaultTimeout={}", queueName, defaultTimeout);
    }

    public Result<JobId> enqueue(String functionRef, List<?> args) {
        return enqueue(functionRef, args, Map.of(), defaultTimeout);
    }

    public Result<JobId> enqueue(String functionRef, List<?> args, Map<String, ?> kwargs) {
        return enqueue(functionRef, args, kwargs, defaultTimeout);
    }

    /**
     * Submits one job. The function reference is forwarded untouched; the worker
     * resolves it. No retry is attempted on failure.
     *
     * @param timeout how long the worker may run the job before it is failed
     */
    public Result<JobId> enqueue(String functionRef, List<?> args, Map<String, ?> kwargs, Duration timeout) {
        return call("enqueue", "Failed to enqueue job", null, () -> {
            EnqueueRequest request = new EnqueueRequest(
                    functionRef,
                    args == null ? null : new ArrayList<>(args),
                    kwargs == null ? null : new LinkedHashMap<>(kwargs),
                    timeout
            );
            JobId jobId = backend.enqueue(queueName, request);
            if (jobId == null) {
                throw new IllegalStateException("backend returned no job id");
            }
            metrics.incEnqueued();
            log.info("[JobQueueClient] enqueued jobId={}, queue={}, func={}", jobId, queueName, functionRef);
            return Result.ok(jobId);
        });
    }

    public Result<JobStatus> status(JobId jobId) {
        return call("status", "Failed to get job status", jobId,
                () -> Result.ok(statusOf(backend.fetch(jobId))));
    }

    public Result<Map<String, Object>> metadata(JobId jobId) {
        return call("metadata", "Failed to get job metadata", jobId, () -> {
            Map<String, Object> meta = backend.fetch(jobId).getMeta();
            return Result.ok(meta == null ? Map.of() : meta);
        });
    }

    /**
     * Forwards a cancel request. What happens to a job that already reached a
     * terminal state is up to the backend; its refusal comes back as an error.
     */
    public Result<Void> cancel(JobId jobId) {
        return call("cancel", "Failed to cancel job", jobId, () -> {
            backend.cancel(queueName, jobId);
            metrics.incCanceled();
            log.info("[JobQueueClient] cancel requested jobId={}, queue={}", jobId, queueName);
            return Result.<Void>ok(null);
        });
    }

    /**
     * Returns the stored result of a {@code finished} job. For a job in any other
     * state the error carries {@link JobErrorCode#JOB_NOT_FINISHED} and the current status.
     */
    public Result<Object> result(JobId jobId) {
        return call("result", "Failed to get job result", jobId, () -> {
            JobRecord job = backend.fetch(jobId);
            JobStatus status = statusOf(job);
            if (status == JobStatus.FINISHED) {
                return Result.ok(job.getResult());
            }
            return Result.err(JobErrorCode.JOB_NOT_FINISHED,
                    "Job is not finished yet (status: " + status.value() + ")");
        });
    }

    /** Number of jobs waiting in this client's queue. */
    public Result<Long> queueLength() {
        return call("queue_length", "Failed to get queue length", null,
                () -> Result.ok(backend.queueLength(queueName)));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && ownedConnection != null) {
            try {
                ownedConnection.close();
                log.info("[JobQueueClient] connection released queue={}", queueName);
            } catch (Exception e) {
                log.warn("[JobQueueClient] connection release failed queue={}, err={}", queueName, e.toString());
            }
        }
    }

    private <T> Result<T> call(String operation, String failurePrefix, JobId jobId, Supplier<Result<T>> body) {
        Result<T> result;
        try {
            result = metrics.operationTimer(operation).record(body);
        } catch (Exception e) {
            result = Result.err(codeOf(e), failurePrefix + ": " + messageOf(e));
        }
        if (result instanceof Result.Err<T> err) {
            metrics.incFailure(operation);
            log.warn("[JobQueueClient] {} failed jobId={}, code={}, msg={}",
                    operation, jobId, err.code(), err.message());
        }
        return result;
    }

    private static JobStatus statusOf(JobRecord job) {
        return JobStatus.fromValue(job.getStatus())
                .orElseThrow(() -> new IllegalStateException("unknown job status '" + job.getStatus() + "'"));
    }

    private static JobErrorCode codeOf(Exception e) {
        if (e instanceof NoSuchJobException) return JobErrorCode.JOB_NOT_FOUND;
        if (e instanceof InvalidJobOperationException) return JobErrorCode.INVALID_JOB_OPERATION;
        if (e instanceof InvalidJobRequestException) return JobErrorCode.INVALID_REQUEST;
        if (e instanceof DataAccessResourceFailureException
                || e instanceof TransientDataAccessException) return JobErrorCode.BACKEND_UNAVAILABLE;
        return JobErrorCode.BACKEND_ERROR;
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.toString();
    }

    private void releaseConnection(BackendConnectionException fatal) {
        if (ownedConnection == null) return;
        try {
            ownedConnection.close();
        } catch (Exception e) {
            fatal.addSuppressed(e);
        }
    }
}

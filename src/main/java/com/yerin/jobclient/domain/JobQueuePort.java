package com.yerin.jobclient.domain;

/**
 * Transport-side operations the client needs from a queue backend.
 * Implementations may throw any runtime exception; the client translates them.
 */
public interface JobQueuePort {

    /** Round trip used to prove the connection is alive. */
    void ping();

    /** Stores a new job in {@link JobStatus#QUEUED} and pushes it onto {@code queue}. */
    JobId enqueue(String queue, EnqueueRequest request);

    JobRecord fetch(JobId jobId) throws NoSuchJobException;

    /**
     * Cancels the job on the queue it was enqueued on (its origin); {@code queue}
     * is the fallback for records that carry no origin.
     */
    void cancel(String queue, JobId jobId) throws NoSuchJobException, InvalidJobOperationException;

    long queueLength(String queue);
}

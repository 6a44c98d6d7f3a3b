package com.yerin.jobclient.client;

import com.yerin.jobclient.domain.JobClientMetrics;
import com.yerin.jobclient.domain.JobId;
import com.yerin.jobclient.domain.JobStatus;
import com.yerin.jobclient.global.exception.code.JobErrorCode;
import com.yerin.jobclient.infra.InMemoryJobQueueAdapter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JobQueueClient + 인메모리 백엔드 라이프사이클")
public class JobQueueClientInMemoryTest {

    InMemoryJobQueueAdapter backend = new InMemoryJobQueueAdapter();
    JobQueueClient client = new JobQueueClient(backend, "default", JobQueueClient.DEFAULT_TIMEOUT,
            new JobClientMetrics(new SimpleMeterRegistry()));

    private JobId enqueueNoop() {
        Result<JobId> r = client.enqueue("app.tasks.noop", List.of());
        assertThat(r.isOk()).isTrue();
        return ((Result.Ok<JobId>) r).value();
    }

    @Test
    @DisplayName("enqueue 직후 상태는 queued, 결과 조회는 Err")
    void freshly_enqueued_job_is_queued() {
        JobId id = enqueueNoop();

        assertThat(id.value()).isNotBlank();
        assertThat(client.status(id)).isEqualTo(Result.ok(JobStatus.QUEUED));
        assertThat(client.result(id)).isEqualTo(
                Result.err(JobErrorCode.JOB_NOT_FINISHED, "Job is not finished yet (status: queued)"));
        assertThat(client.queueLength()).isEqualTo(Result.ok(1L));
    }

    @Test
    @DisplayName("다른 큐에 묶인 클라이언트가 취소해도 원래 큐에서 빠짐")
    void cancel_through_client_of_another_queue() {
        JobQueueClient a = new JobQueueClient(backend, "a", JobQueueClient.DEFAULT_TIMEOUT,
                new JobClientMetrics(new SimpleMeterRegistry()));
        JobQueueClient b = new JobQueueClient(backend, "b", JobQueueClient.DEFAULT_TIMEOUT,
                new JobClientMetrics(new SimpleMeterRegistry()));
        JobId id = a.enqueue("app.tasks.noop", List.of())
                .orElseThrow(err -> new IllegalStateException(err.message()));
        b.enqueue("app.tasks.noop", List.of());

        assertThat(b.cancel(id).isOk()).isTrue();

        assertThat(a.status(id)).isEqualTo(Result.ok(JobStatus.CANCELED));
        assertThat(a.queueLength()).isEqualTo(Result.ok(0L));
        assertThat(b.queueLength()).isEqualTo(Result.ok(1L));
    }

    @Test
    @DisplayName("cancel → canceled, 큐에서 제거, 재취소는 거부")
    void cancel_transitions_to_canceled() {
        JobId id = enqueueNoop();

        assertThat(client.cancel(id).isOk()).isTrue();
        assertThat(client.status(id)).isEqualTo(Result.ok(JobStatus.CANCELED));
        assertThat(client.queueLength()).isEqualTo(Result.ok(0L));

        Result<Void> again = client.cancel(id);
        assertThat(again).isInstanceOfSatisfying(Result.Err.class,
                err -> assertThat(err.code()).isEqualTo(JobErrorCode.INVALID_JOB_OPERATION));
    }

    @Test
    @DisplayName("형식은 맞지만 없는 id는 모든 조회/취소에서 Err")
    void unknown_but_well_formed_id() {
        JobId unknown = JobId.of("does-not-exist");

        assertThat(client.status(unknown).isErr()).isTrue();
        assertThat(client.metadata(unknown).isErr()).isTrue();
        assertThat(client.cancel(unknown).isErr()).isTrue();
        assertThat(client.result(unknown).isErr()).isTrue();
    }

    @Test
    @DisplayName("메타데이터 없는 새 작업은 빈 맵")
    void new_job_has_empty_metadata() {
        JobId id = enqueueNoop();

        assertThat(client.metadata(id)).isEqualTo(Result.ok(Map.of()));
    }

    @Test
    @DisplayName("여러 스레드에서 동시에 enqueue해도 id가 겹치지 않음")
    void concurrent_enqueue_gives_distinct_ids() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Result<JobId>>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                final int n = i;
                tasks.add(() -> client.enqueue("app.tasks.square", List.of(n)));
            }
            List<JobId> ids = new ArrayList<>();
            for (Future<Result<JobId>> f : pool.invokeAll(tasks)) {
                ids.add(f.get(5, TimeUnit.SECONDS).orElseThrow(err -> new IllegalStateException(err.message())));
            }
            assertThat(ids).hasSize(200).doesNotHaveDuplicates();
            assertThat(client.queueLength()).isEqualTo(Result.ok(200L));
        } finally {
            pool.shutdownNow();
        }
    }
}

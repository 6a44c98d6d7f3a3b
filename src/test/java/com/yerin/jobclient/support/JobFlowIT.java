package com.yerin.jobclient.support;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DisplayName("E2E: enqueue → (외부) worker → finished")
class JobFlowIT extends IntegrationTestBase {

    @Autowired
    TestRestTemplate rest;

    @Autowired
    StringRedisTemplate redis;

    TestWorker worker;

    @BeforeEach
    void startWorker() {
        worker = new TestWorker(redis, "rq", "default").start();
    }

    @AfterEach
    void stopWorker() {
        worker.close();
    }

    private String enqueue(String function) {
        ResponseEntity<Map> created = rest.postForEntity("/jobs",
                Map.of("function", function, "args", List.of(6, 7)), Map.class);
        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<?, ?> data = (Map<?, ?>) created.getBody().get("data");
        return String.valueOf(data.get("jobId"));
    }

    private Map<?, ?> data(ResponseEntity<Map> r) {
        assertThat(r.getBody()).isNotNull();
        return (Map<?, ?>) r.getBody().get("data");
    }

    @Test
    @DisplayName("성공 플로우: tests.answer → finished, result 42")
    void success_flow() {
        String jobId = enqueue(TestWorker.ANSWER);

        Awaitility.await()
                .atMost(Duration.ofSeconds(8))
                .pollInterval(Duration.ofMillis(300))
                .untilAsserted(() -> {
                    ResponseEntity<Map> r = rest.getForEntity("/jobs/{id}/status", Map.class, jobId);
                    assertThat(r.getStatusCode().is2xxSuccessful()).isTrue();
                    assertThat(data(r).get("status")).isEqualTo("finished");
                });

        ResponseEntity<Map> result = rest.getForEntity("/jobs/{id}/result", Map.class, jobId);
        assertThat(data(result).get("result")).isEqualTo(42);

        ResponseEntity<Map> job = rest.getForEntity("/jobs/{id}", Map.class, jobId);
        @SuppressWarnings("unchecked")
        Map<String, Object> meta = (Map<String, Object>) data(job).get("meta");
        assertThat(meta).containsEntry("progress", 100);
    }

    @Test
    @DisplayName("실패 플로우: 알 수 없는 함수 → failed, result는 409")
    void failure_flow() {
        String jobId = enqueue("tests.unknown");

        Awaitility.await()
                .atMost(Duration.ofSeconds(8))
                .pollInterval(Duration.ofMillis(300))
                .untilAsserted(() -> {
                    ResponseEntity<Map> r = rest.getForEntity("/jobs/{id}/status", Map.class, jobId);
                    assertThat(data(r).get("status")).isEqualTo("failed");
                });

        ResponseEntity<Map> result = rest.getForEntity("/jobs/{id}/result", Map.class, jobId);
        assertThat(result.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(result.getBody().get("message")).isEqualTo("Job is not finished yet (status: failed)");
    }

    @Test
    @DisplayName("완료된 작업 취소는 409")
    void cancel_finished_job_is_conflict() {
        String jobId = enqueue(TestWorker.ANSWER);
        Awaitility.await()
                .atMost(Duration.ofSeconds(8))
                .untilAsserted(() -> assertThat(
                        data(rest.getForEntity("/jobs/{id}/status", Map.class, jobId)).get("status"))
                        .isEqualTo("finished"));

        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Admin-Token", "test-admin-token");
        ResponseEntity<Map> r = rest.postForEntity("/admin/jobs/{id}/cancel",
                new HttpEntity<>(null, headers), Map.class, jobId);

        assertThat(r.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(r.getBody().get("code")).isEqualTo("JOB-003");
    }
}

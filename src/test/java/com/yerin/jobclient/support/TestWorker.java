package com.yerin.jobclient.support;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Stand-in for an external worker: pops ids from a queue list and writes the
 * state transitions a real worker would write. Knows exactly one function,
 * {@value #ANSWER}, which returns 42.
 */
@Slf4j
public class TestWorker implements AutoCloseable {

    public static final String ANSWER = "tests.answer";

    private final StringRedisTemplate redis;
    private final String prefix;
    private final String queue;
    private final ExecutorService loop = Executors.newSingleThreadExecutor();

    public TestWorker(StringRedisTemplate redis, String prefix, String queue) {
        this.redis = redis;
        this.prefix = prefix;
        this.queue = queue;
    }

    public TestWorker start() {
        loop.submit(() -> {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    String id = redis.opsForList().leftPop(prefix + ":queue:" + queue, Duration.ofMillis(200));
                    if (id != null) work(id);
                } catch (Exception e) {
                    if (Thread.currentThread().isInterrupted()) return;
                    log.warn("[TestWorker] loop error: {}", e.toString());
                }
            }
        });
        return this;
    }

    private void work(String id) {
        String key = prefix + ":job:" + id;
        Object func = redis.opsForHash().get(key, "func_name");
        redis.opsForHash().putAll(key, Map.of(
                "status", "started",
                "started_at", Instant.now().toString(),
                "meta", "{\"progress\":0}"));

        if (ANSWER.equals(func)) {
            redis.opsForHash().putAll(key, Map.of(
                    "status", "finished",
                    "ended_at", Instant.now().toString(),
                    "meta", "{\"progress\":100}",
                    "result", "42"));
        } else {
            redis.opsForHash().putAll(key, Map.of(
                    "status", "failed",
                    "ended_at", Instant.now().toString(),
                    "exc_info", "unknown function " + func));
        }
        log.info("[TestWorker] processed jobId={}, func={}", id, func);
    }

    @Override
    public void close() {
        loop.shutdownNow();
    }
}

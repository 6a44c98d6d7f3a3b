package com.yerin.jobclient.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.jobclient.domain.EnqueueRequest;
import com.yerin.jobclient.domain.InvalidJobOperationException;
import com.yerin.jobclient.domain.InvalidJobRequestException;
import com.yerin.jobclient.domain.JobId;
import com.yerin.jobclient.domain.JobQueuePort;
import com.yerin.jobclient.domain.JobRecord;
import com.yerin.jobclient.domain.JobStatus;
import com.yerin.jobclient.domain.NoSuchJobException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores jobs as Redis hashes and queues as lists. Arguments, metadata and
 * results are JSON so workers in any language can read them.
 */
@Slf4j
public class RedisJobQueueAdapter implements JobQueuePort {

    static final String STATUS = "status";
    static final String ORIGIN = "origin";
    static final String FUNC_NAME = "func_name";
    static final String ARGS = "args";
    static final String KWARGS = "kwargs";
    static final String DESCRIPTION = "description";
    static final String TIMEOUT = "timeout";
    static final String CREATED_AT = "created_at";
    static final String ENQUEUED_AT = "enqueued_at";
    static final String STARTED_AT = "started_at";
    static final String ENDED_AT = "ended_at";
    static final String META = "meta";
    static final String RESULT = "result";
    static final String EXC_INFO = "exc_info";

    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final StringRedisTemplate redis;
    private final ObjectMapper om;
    private final RedisKeys keys;

    public RedisJobQueueAdapter(StringRedisTemplate redis, ObjectMapper om, RedisKeys keys) {
        this.redis = redis;
        this.om = om;
        this.keys = keys;
    }

    @Override
    public void ping() {
        String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
        if (pong == null) {
            throw new IllegalStateException("no PING reply from redis");
        }
    }

    @Override
    public JobId enqueue(String queue, EnqueueRequest request) {
        JobId jobId = JobId.of(UUID.randomUUID().toString());
        String now = Instant.now().toString();

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(STATUS, JobStatus.QUEUED.value());
        fields.put(ORIGIN, queue);
        fields.put(FUNC_NAME, request.functionRef());
        fields.put(ARGS, writeArgument(request.args()));
        fields.put(KWARGS, writeArgument(request.kwargs()));
        fields.put(DESCRIPTION, request.description());
        fields.put(TIMEOUT, String.valueOf(request.timeout().toSeconds()));
        fields.put(CREATED_AT, now);
        fields.put(ENQUEUED_AT, now);
        fields.put(META, "{}");

        String jobKey = keys.job(jobId);
        String queueKey = keys.queue(queue);

        redis.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForHash().putAll(jobKey, fields);
                ops.opsForSet().add(keys.queues(), queueKey);
                ops.opsForList().rightPush(queueKey, jobId.value());
                return ops.exec();
            }
        });

        log.info("[RedisQueue] RPUSH key={}, jobId={}, func={}", queueKey, jobId, request.functionRef());
        return jobId;
    }

    @Override
    public JobRecord fetch(JobId jobId) {
        HashOperations<String, String, String> hash = redis.opsForHash();
        Map<String, String> raw = hash.entries(keys.job(jobId));
        if (raw == null || raw.isEmpty()) {
            throw new NoSuchJobException(jobId);
        }

        return JobRecord.builder()
                .id(jobId)
                .status(raw.get(STATUS))
                .origin(raw.get(ORIGIN))
                .functionRef(raw.get(FUNC_NAME))
                .args(Optional.ofNullable(read(jobId, ARGS, raw.get(ARGS), LIST_TYPE)).orElse(List.of()))
                .kwargs(Optional.ofNullable(read(jobId, KWARGS, raw.get(KWARGS), MAP_TYPE)).orElse(Map.of()))
                .description(raw.get(DESCRIPTION))
                .timeout(seconds(jobId, raw.get(TIMEOUT)))
                .createdAt(instant(jobId, CREATED_AT, raw.get(CREATED_AT)))
                .enqueuedAt(instant(jobId, ENQUEUED_AT, raw.get(ENQUEUED_AT)))
                .startedAt(instant(jobId, STARTED_AT, raw.get(STARTED_AT)))
                .endedAt(instant(jobId, ENDED_AT, raw.get(ENDED_AT)))
                .meta(Optional.ofNullable(read(jobId, META, raw.get(META), MAP_TYPE)).orElse(Map.of()))
                .result(read(jobId, RESULT, raw.get(RESULT), new TypeReference<Object>() {}))
                .excInfo(raw.get(EXC_INFO))
                .build();
    }

    /**
     * Marks the job canceled, drops it from the list of the queue it was enqueued
     * on and records it in that queue's canceled registry. Jobs already in a
     * terminal state are refused. {@code queue} is only used when the job hash
     * carries no origin.
     */
    @Override
    public void cancel(String queue, JobId jobId) {
        String jobKey = keys.job(jobId);
        HashOperations<String, String, String> hash = redis.opsForHash();
        List<String> stored = hash.multiGet(jobKey, List.of(STATUS, ORIGIN));
        String current = stored == null ? null : stored.get(0);
        if (current == null) {
            throw new NoSuchJobException(jobId);
        }
        String origin = stored.get(1) == null || stored.get(1).isBlank() ? queue : stored.get(1);
        JobStatus.fromValue(current)
                .filter(JobStatus::isTerminal)
                .ifPresent(s -> {
                    throw new InvalidJobOperationException("Cannot cancel job in terminal state: " + s.value());
                });

        Instant now = Instant.now();
        String queueKey = keys.queue(origin);
        String canceledKey = keys.canceled(origin);

        redis.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForHash().put(jobKey, STATUS, JobStatus.CANCELED.value());
                ops.opsForHash().put(jobKey, ENDED_AT, now.toString());
                ops.opsForList().remove(queueKey, 0, jobId.value());
                ops.opsForZSet().add(canceledKey, jobId.value(), now.getEpochSecond());
                return ops.exec();
            }
        });

        log.info("[RedisQueue] canceled jobId={}, previous={}, registry={}", jobId, current, canceledKey);
    }

    @Override
    public long queueLength(String queue) {
        Long size = redis.opsForList().size(keys.queue(queue));
        return size == null ? 0L : size;
    }

    private String writeArgument(Object value) {
        try {
            return om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InvalidJobRequestException("job arguments are not JSON serializable: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T read(JobId jobId, String field, String json, TypeReference<T> type) {
        if (json == null) return null;
        try {
            return om.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Could not read field '" + field + "' of job " + jobId, e);
        }
    }

    private static Duration seconds(JobId jobId, String value) {
        if (value == null) return null;
        try {
            return Duration.ofSeconds(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new SerializationException("Could not read field '" + TIMEOUT + "' of job " + jobId
                    + ": '" + value + "' is not a whole number of seconds", e);
        }
    }

    private static Instant instant(JobId jobId, String field, String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new SerializationException("Could not read field '" + field + "' of job " + jobId
                    + ": '" + value + "' is not an ISO-8601 instant", e);
        }
    }
}

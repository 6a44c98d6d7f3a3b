package com.yerin.jobclient.config;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.yerin.jobclient.client.BackendConnectionException;
import com.yerin.jobclient.client.JobQueueClient;
import com.yerin.jobclient.domain.JobClientMetrics;
import com.yerin.jobclient.infra.BackendAddressResolver;
import com.yerin.jobclient.infra.RedisJobQueueAdapter;
import com.yerin.jobclient.infra.RedisKeys;
import com.yerin.jobclient.infra.RedisUrl;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Builds standalone clients (outside a Spring context) that own their Redis connection.
 *
 * <pre>{@code
 * try (JobQueueClient client = JobQueueClients.connect()) {
 *     Result<JobId> id = client.enqueue("app.tasks.export_report", List.of(2024));
 * }
 * }</pre>
 */
@Slf4j
public final class JobQueueClients {

    public static final String DEFAULT_QUEUE = "default";
    public static final String DEFAULT_KEY_PREFIX = "rq";
    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(10);

    private JobQueueClients() {}

    /** Connects to {@code REDIS_URL}, or the local default when unset. */
    public static JobQueueClient connect() {
        return connect(null);
    }

    public static JobQueueClient connect(String redisUrl) {
        return connect(redisUrl, DEFAULT_QUEUE, new SimpleMeterRegistry());
    }

    /**
     * @throws BackendConnectionException if the address is invalid or Redis does not answer
     */
    public static JobQueueClient connect(String redisUrl, String queueName, MeterRegistry registry) {
        String resolved = BackendAddressResolver.resolve(redisUrl);

        LettuceConnectionFactory factory;
        try {
            factory = RedisConnectionFactories.lettuce(RedisUrl.parse(resolved), DEFAULT_COMMAND_TIMEOUT);
            factory.afterPropertiesSet();
            factory.start();
        } catch (RuntimeException e) {
            log.error("[JobQueueClients] cannot open connection url={}, cause={}", safe(resolved), e.toString());
            throw new BackendConnectionException("Failed to connect to Redis: " + e.getMessage(), e);
        }

        RedisJobQueueAdapter adapter = new RedisJobQueueAdapter(
                new StringRedisTemplate(factory),
                JsonMapper.builder().findAndAddModules().build(),
                new RedisKeys(DEFAULT_KEY_PREFIX)
        );
        return new JobQueueClient(adapter, queueName, JobQueueClient.DEFAULT_TIMEOUT,
                new JobClientMetrics(registry), factory::destroy);
    }

    // 로그에 비밀번호가 남지 않도록 파싱된 형태만 출력
    private static String safe(String url) {
        try {
            return RedisUrl.parse(url).toString();
        } catch (IllegalArgumentException e) {
            return "<unparseable>";
        }
    }
}

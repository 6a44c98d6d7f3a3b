package com.yerin.jobclient.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.jobclient.domain.JobQueuePort;
import com.yerin.jobclient.infra.BackendAddressResolver;
import com.yerin.jobclient.infra.RedisJobQueueAdapter;
import com.yerin.jobclient.infra.RedisKeys;
import com.yerin.jobclient.infra.RedisUrl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

@Slf4j
@Configuration
@Profile("!local-inmem")
public class RedisBackendConfig {

    @Value("${jobq.redis.url:}")
    private String redisUrl;

    @Value("${jobq.redis.command-timeout:10s}")
    private Duration commandTimeout;

    @Value("${jobq.redis.key-prefix:rq}")
    private String keyPrefix;

    @Bean
    public LettuceConnectionFactory redisConnectionFactory() {
        RedisUrl url = RedisUrl.parse(BackendAddressResolver.resolve(redisUrl));
        log.info("[RedisBackend] url={}, commandTimeout={}", url, commandTimeout);
        return RedisConnectionFactories.lettuce(url, commandTimeout);
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory redisConnectionFactory) {
        return new StringRedisTemplate(redisConnectionFactory);
    }

    @Bean
    public JobQueuePort jobQueuePort(StringRedisTemplate stringRedisTemplate, ObjectMapper objectMapper) {
        return new RedisJobQueueAdapter(stringRedisTemplate, objectMapper, new RedisKeys(keyPrefix));
    }
}

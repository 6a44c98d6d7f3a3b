package com.yerin.jobclient.config;

import com.yerin.jobclient.infra.RedisUrl;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

import java.time.Duration;

public final class RedisConnectionFactories {
    private RedisConnectionFactories() {}

    /** Builds an unstarted Lettuce factory; the command timeout bounds every backend call. */
    public static LettuceConnectionFactory lettuce(RedisUrl url, Duration commandTimeout) {
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(url.host(), url.port());
        standalone.setDatabase(url.database());
        if (url.username() != null) standalone.setUsername(url.username());
        if (url.password() != null) standalone.setPassword(RedisPassword.of(url.password()));

        LettuceClientConfiguration.LettuceClientConfigurationBuilder client =
                LettuceClientConfiguration.builder().commandTimeout(commandTimeout);
        if (url.ssl()) client.useSsl();

        return new LettuceConnectionFactory(standalone, client.build());
    }
}

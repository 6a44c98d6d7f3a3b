package com.yerin.jobclient.config;

import com.yerin.jobclient.domain.JobQueuePort;
import com.yerin.jobclient.infra.InMemoryJobQueueAdapter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("local-inmem") // Redis 없이 로컬 실행할 때만
public class InMemoryBackendConfig {

    @Bean
    public JobQueuePort jobQueuePort() {
        return new InMemoryJobQueueAdapter();
    }
}

package com.yerin.jobclient.config;

import com.yerin.jobclient.client.JobQueueClient;
import com.yerin.jobclient.domain.JobClientMetrics;
import com.yerin.jobclient.domain.JobQueuePort;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class JobClientConfig {

    @Value("${jobq.queue.name:default}")
    private String queueName;

    @Value("${jobq.queue.default-timeout:1h}")
    private Duration defaultTimeout;

    // ping 실패 시 생성자에서 예외 → 컨텍스트 기동 실패
    @Bean
    public JobQueueClient jobQueueClient(JobQueuePort jobQueuePort, JobClientMetrics metrics) {
        return new JobQueueClient(jobQueuePort, queueName, defaultTimeout, metrics);
    }
}

package com.yerin.jobclient.controller;

import com.yerin.jobclient.client.JobQueueClient;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/admin/metrics")
@RequiredArgsConstructor
public class AdminMetricsController {

    private final JobQueueClient jobQueueClient;

    @GetMapping("/queue")
    public Map<String, Object> queue(@RequestHeader(value = "X-Admin-Token", required = true)
                                     @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                     String adminToken) {
        long length = jobQueueClient.queueLength().orElseThrow(ClientErrors::toAppException);
        return Map.of(
                "queue", jobQueueClient.getQueueName(),
                "length", length,
                "ts", Instant.now().toString()
        );
    }
}

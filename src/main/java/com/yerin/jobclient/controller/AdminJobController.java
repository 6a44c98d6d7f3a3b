package com.yerin.jobclient.controller;

import com.yerin.jobclient.client.JobQueueClient;
import com.yerin.jobclient.domain.JobId;
import com.yerin.jobclient.domain.JobStatus;
import com.yerin.jobclient.dto.response.JobStatusResponse;
import com.yerin.jobclient.global.dto.DataResponse;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import static com.yerin.jobclient.controller.ClientErrors.parseId;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/jobs")
public class AdminJobController {
    private final JobQueueClient jobQueueClient;

    @PostMapping("/{id}/cancel")
    public ResponseEntity<DataResponse<JobStatusResponse>> cancel(@PathVariable String id,
                                                                  @RequestHeader(value = "X-Admin-Token", required = true)
                                                                  @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                  String adminToken) {
        JobId jobId = parseId(id);
        jobQueueClient.cancel(jobId).orElseThrow(ClientErrors::toAppException);
        return ResponseEntity.ok(DataResponse.from(new JobStatusResponse(jobId.value(), JobStatus.CANCELED)));
    }
}

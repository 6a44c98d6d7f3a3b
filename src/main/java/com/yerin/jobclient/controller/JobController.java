package com.yerin.jobclient.controller;

import com.yerin.jobclient.client.JobQueueClient;
import com.yerin.jobclient.domain.JobId;
import com.yerin.jobclient.domain.JobStatus;
import com.yerin.jobclient.dto.request.EnqueueJobRequest;
import com.yerin.jobclient.dto.response.JobIdResponse;
import com.yerin.jobclient.dto.response.JobMetaResponse;
import com.yerin.jobclient.dto.response.JobResponse;
import com.yerin.jobclient.dto.response.JobResultResponse;
import com.yerin.jobclient.dto.response.JobStatusResponse;
import com.yerin.jobclient.global.dto.DataResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;

import static com.yerin.jobclient.controller.ClientErrors.parseId;

@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobQueueClient jobQueueClient;

    @PostMapping
    public ResponseEntity<DataResponse<JobIdResponse>> enqueue(@Valid @RequestBody EnqueueJobRequest body) {
        Duration timeout = body.timeoutSeconds() == null
                ? jobQueueClient.getDefaultTimeout()
                : Duration.ofSeconds(body.timeoutSeconds());

        JobId jobId = jobQueueClient.enqueue(body.function(), body.args(), body.kwargs(), timeout)
                .orElseThrow(ClientErrors::toAppException);

        return ResponseEntity.ok(DataResponse.from(new JobIdResponse(jobId.value())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DataResponse<JobResponse>> get(@PathVariable String id) {
        JobId jobId = parseId(id);
        JobStatus status = jobQueueClient.status(jobId).orElseThrow(ClientErrors::toAppException);
        Map<String, Object> meta = jobQueueClient.metadata(jobId).orElseThrow(ClientErrors::toAppException);

        return ResponseEntity.ok(DataResponse.from(new JobResponse(jobId.value(), status, meta)));
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<DataResponse<JobStatusResponse>> status(@PathVariable String id) {
        JobId jobId = parseId(id);
        JobStatus status = jobQueueClient.status(jobId).orElseThrow(ClientErrors::toAppException);
        return ResponseEntity.ok(DataResponse.from(new JobStatusResponse(jobId.value(), status)));
    }

    @GetMapping("/{id}/meta")
    public ResponseEntity<DataResponse<JobMetaResponse>> meta(@PathVariable String id) {
        JobId jobId = parseId(id);
        Map<String, Object> meta = jobQueueClient.metadata(jobId).orElseThrow(ClientErrors::toAppException);
        return ResponseEntity.ok(DataResponse.from(new JobMetaResponse(jobId.value(), meta)));
    }

    @GetMapping("/{id}/result")
    public ResponseEntity<DataResponse<JobResultResponse>> result(@PathVariable String id) {
        JobId jobId = parseId(id);
        Object result = jobQueueClient.result(jobId).orElseThrow(ClientErrors::toAppException);
        return ResponseEntity.ok(DataResponse.from(new JobResultResponse(jobId.value(), result)));
    }
}

package com.yerin.jobclient.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.jobclient.domain.JobStatus;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        String jobId,
        JobStatus status,
        Map<String, Object> meta
) {}

package com.yerin.jobclient.dto.response;

import com.yerin.jobclient.domain.JobStatus;

public record JobStatusResponse(String jobId, JobStatus status) {}

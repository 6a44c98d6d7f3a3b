package com.yerin.jobclient.dto.response;

public record JobResultResponse(String jobId, Object result) {}

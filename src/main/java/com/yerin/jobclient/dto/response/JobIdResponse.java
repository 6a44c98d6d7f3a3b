package com.yerin.jobclient.dto.response;

public record JobIdResponse(String jobId) {}

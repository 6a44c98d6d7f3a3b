package com.yerin.jobclient.dto.response;

import java.util.Map;

public record JobMetaResponse(String jobId, Map<String, Object> meta) {}

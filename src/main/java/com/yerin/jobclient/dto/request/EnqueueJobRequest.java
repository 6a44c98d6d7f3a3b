package com.yerin.jobclient.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.util.List;
import java.util.Map;

public record EnqueueJobRequest(
        @NotBlank String function,
        List<Object> args,
        Map<String, Object> kwargs,
        @Positive Long timeoutSeconds
) {}

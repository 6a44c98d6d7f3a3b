package com.yerin.jobclient.controller;

import com.yerin.jobclient.client.Result;
import com.yerin.jobclient.domain.JobId;
import com.yerin.jobclient.global.exception.AppException;
import com.yerin.jobclient.global.exception.code.JobErrorCode;

final class ClientErrors {
    private ClientErrors() {}

    static AppException toAppException(Result.Err<?> err) {
        return new AppException(err.code().withDetail(err.message()));
    }

    static JobId parseId(String raw) {
        try {
            return JobId.of(raw);
        } catch (IllegalArgumentException e) {
            throw new AppException(JobErrorCode.INVALID_REQUEST.withDetail(e.getMessage()), e);
        }
    }
}

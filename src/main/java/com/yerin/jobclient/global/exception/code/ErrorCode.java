package com.yerin.jobclient.global.exception.code;

import org.springframework.http.HttpStatus;

/**
 * HTTP-facing error vocabulary. {@link #withDetail(String)} keeps the code and
 * status but replaces the generic message with the backend's own.
 */
public interface ErrorCode {
    HttpStatus getHttpStatus();
    String getMessage();
    String getCode();

    default boolean isServerError() {
        return getHttpStatus().is5xxServerError();
    }

    default ErrorCode withDetail(String detailMessage) {
        return new Detailed(this, detailMessage == null ? getMessage() : detailMessage);
    }

    record Detailed(ErrorCode base, String message) implements ErrorCode {
        @Override
        public HttpStatus getHttpStatus() {
            return base.getHttpStatus();
        }

        @Override
        public String getMessage() {
            return message;
        }

        @Override
        public String getCode() {
            return base.getCode();
        }
    }
}

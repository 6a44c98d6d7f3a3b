package com.yerin.jobclient.global.exception;

import com.yerin.jobclient.global.exception.code.ErrorCode;
import lombok.Getter;

/** Carries an {@link ErrorCode} to {@link ExceptionController}, which renders it. */
@Getter
public class AppException extends RuntimeException {

    private final ErrorCode errorCode;

    public AppException(ErrorCode errorCode) {
        this(errorCode, null);
    }

    public AppException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getCode() + " " + errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }
}

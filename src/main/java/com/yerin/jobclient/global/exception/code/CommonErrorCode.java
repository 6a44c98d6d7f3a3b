package com.yerin.jobclient.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum CommonErrorCode implements ErrorCode {
    INVALID_PARAMETER(HttpStatus.BAD_REQUEST, "요청 파라미터가 잘못되었습니다.", "COMMON-002"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "관리자 토큰이 필요합니다.", "COMMON-005"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부에서 에러가 발생했습니다.", "COMMON-004");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}

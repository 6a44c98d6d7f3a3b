package com.yerin.jobclient.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum JobErrorCode implements ErrorCode {
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "작업을 찾을 수 없습니다.", "JOB-001"),
    JOB_NOT_FINISHED(HttpStatus.CONFLICT, "작업이 아직 완료되지 않았습니다.", "JOB-002"),
    INVALID_JOB_OPERATION(HttpStatus.CONFLICT, "현재 작업 상태에서 허용되지 않는 요청입니다.", "JOB-003"),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "작업 요청 값이 올바르지 않습니다.", "JOB-004"),
    BACKEND_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "큐 백엔드에 연결할 수 없습니다.", "JOB-005"),
    BACKEND_ERROR(HttpStatus.BAD_GATEWAY, "큐 백엔드 처리 중 오류가 발생했습니다.", "JOB-006");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}

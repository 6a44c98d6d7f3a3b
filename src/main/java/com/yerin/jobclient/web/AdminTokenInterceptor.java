package com.yerin.jobclient.web;

import com.yerin.jobclient.global.exception.AppException;
import com.yerin.jobclient.global.exception.code.CommonErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the admin endpoints (cancel, queue metrics) with a shared token sent in
 * {@value #HEADER}. Rejections surface as {@link CommonErrorCode#UNAUTHORIZED}.
 */
@Slf4j
public class AdminTokenInterceptor implements HandlerInterceptor {

    public static final String HEADER = "X-Admin-Token";

    private final byte[] adminToken;

    public AdminTokenInterceptor(String adminToken) {
        this.adminToken = adminToken == null ? new byte[0] : adminToken.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String token = request.getHeader(HEADER);
        // 토큰 미설정이면 관리자 API 전체 차단
        if (adminToken.length > 0 && token != null
                && MessageDigest.isEqual(adminToken, token.getBytes(StandardCharsets.UTF_8))) {
            return true;
        }
        log.warn("[Admin] rejected {} {}, headerPresent={}", request.getMethod(), request.getRequestURI(), token != null);
        throw new AppException(CommonErrorCode.UNAUTHORIZED);
    }
}

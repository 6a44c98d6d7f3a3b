package com.yerin.jobclient.config;

import com.yerin.jobclient.web.AdminTokenInterceptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Slf4j
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    static final String ADMIN_PATHS = "/admin/**";

    @Value("${jobq.admin.token:}")
    private String adminToken;

    @Bean
    public AdminTokenInterceptor adminTokenInterceptor() {
        if (adminToken.isBlank()) {
            log.warn("[Admin] jobq.admin.token is not set; {} will reject every request", ADMIN_PATHS);
        }
        return new AdminTokenInterceptor(adminToken);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(adminTokenInterceptor()).addPathPatterns(ADMIN_PATHS);
    }
}

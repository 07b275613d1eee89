package com.sunny.jobconsole.admin.security;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 管理端接口的身份过滤
 * <p>
 * 只挂在 /jobinfo、/jobgroup、/joblog 下，执行器走的 /api 由 access token 校验
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Configuration
public class SecurityConfig {

    public static final String[] ADMIN_URL_PATTERNS = {"/jobinfo/*", "/jobgroup/*", "/joblog/*"};

    @Bean
    public FilterRegistrationBean<GatewayUserFilter> gatewayUserFilterRegistration(GatewayUserFilter gatewayUserFilter) {
        FilterRegistrationBean<GatewayUserFilter> registration = new FilterRegistrationBean<>(gatewayUserFilter);
        registration.setName("jobconsoleGatewayUserFilter");
        registration.addUrlPatterns(ADMIN_URL_PATTERNS);
        registration.setOrder(1);
        return registration;
    }
}

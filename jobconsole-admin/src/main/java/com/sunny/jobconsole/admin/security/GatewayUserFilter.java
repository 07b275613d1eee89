package com.sunny.jobconsole.admin.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Gateway 用户过滤器
 * 从 Gateway 注入的请求头中提取用户信息，设置到请求属性中
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Slf4j
@Component
public class GatewayUserFilter extends OncePerRequestFilter {

    public static final String HEADER_USER_ID = "X-User-Id";
    public static final String HEADER_USERNAME = "X-Username";
    public static final String HEADER_USER_ROLE = "X-User-Role";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        // 排除不需要认证的路径
        if (isExcludedPath(request.getRequestURI().substring(request.getContextPath().length()))) {
            chain.doFilter(request, response);
            return;
        }

        // 从 Gateway 注入的请求头中提取用户信息
        String userIdStr = request.getHeader(HEADER_USER_ID);
        String username = request.getHeader(HEADER_USERNAME);
        String role = request.getHeader(HEADER_USER_ROLE);

        if (userIdStr != null && !userIdStr.isEmpty()) {
            try {
                Long userId = Long.parseLong(userIdStr.trim());
                JobUser jobUser = new JobUser(userId, username, role == null ? null : role.trim());

                // 将用户信息设置到请求属性中，供后续使用
                request.setAttribute(JobUser.REQUEST_ATTRIBUTE, jobUser);

                log.debug("Gateway 用户信息: {}", jobUser);
            } catch (NumberFormatException e) {
                log.warn("无效的用户ID: {}", userIdStr);
            }
        }

        chain.doFilter(request, response);
    }

    /**
     * 判断是否为排除的路径（不需要认证）
     */
    static boolean isExcludedPath(String path) {
        if (path.startsWith("/actuator/")) {
            return true;
        }

        // 执行器回调与注册，由 access token 保护，不经过 Gateway
        return path.startsWith("/api/");
    }
}

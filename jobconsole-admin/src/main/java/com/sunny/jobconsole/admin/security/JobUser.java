package com.sunny.jobconsole.admin.security;

import com.sunny.jobconsole.core.exception.ForbiddenException;
import com.sunny.jobconsole.core.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Caller identity injected by the gateway.
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
public class JobUser {

    public static final String REQUEST_ATTRIBUTE = "jobUser";
    public static final String ROLE_ADMIN = "ADMIN";

    private final Long userId;
    private final String username;
    private final String role;

    public JobUser(Long userId, String username, String role) {
        this.userId = userId;
        this.username = username;
        this.role = role;
    }

    public Long getUserId() {
        return userId;
    }

    public String getUsername() {
        return username;
    }

    public String getRole() {
        return role;
    }

    public boolean isAdmin() {
        return ROLE_ADMIN.equalsIgnoreCase(role);
    }

    /**
     * @throws UnauthorizedException no identity on the request
     */
    public static JobUser requireLogin(HttpServletRequest request) {
        Object attribute = request.getAttribute(REQUEST_ATTRIBUTE);
        if (!(attribute instanceof JobUser)) {
            throw new UnauthorizedException("login required");
        }
        return (JobUser) attribute;
    }

    /**
     * @throws UnauthorizedException no identity on the request
     * @throws ForbiddenException    identity without the admin role
     */
    public static JobUser requireAdmin(HttpServletRequest request) {
        JobUser user = requireLogin(request);
        if (!user.isAdmin()) {
            throw new ForbiddenException("permission limit, admin role required");
        }
        return user;
    }

    @Override
    public String toString() {
        return "JobUser{" +
                "userId=" + userId +
                ", username='" + username + '\'' +
                ", role='" + role + '\'' +
                '}';
    }
}

package com.sunny.jobconsole.admin.security;

import com.sunny.jobconsole.core.exception.ForbiddenException;
import com.sunny.jobconsole.core.exception.UnauthorizedException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GatewayUserFilterTest {

    private final GatewayUserFilter filter = new GatewayUserFilter();

    private MockHttpServletRequest request(String uri) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/jobconsole" + uri);
        request.setContextPath("/jobconsole");
        return request;
    }

    @Test
    void doFilter_shouldAttachUserFromHeaders() throws Exception {
        MockHttpServletRequest request = request("/jobinfo/trigger");
        request.addHeader(GatewayUserFilter.HEADER_USER_ID, "7");
        request.addHeader(GatewayUserFilter.HEADER_USERNAME, "sunny");
        request.addHeader(GatewayUserFilter.HEADER_USER_ROLE, " admin ");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        JobUser user = (JobUser) request.getAttribute(JobUser.REQUEST_ATTRIBUTE);
        assertEquals(7L, user.getUserId());
        assertEquals("sunny", user.getUsername());
        assertTrue(user.isAdmin());
        assertEquals(user, JobUser.requireAdmin(request));
    }

    @Test
    void doFilter_shouldIgnoreInvalidUserId() throws Exception {
        MockHttpServletRequest request = request("/jobinfo/trigger");
        request.addHeader(GatewayUserFilter.HEADER_USER_ID, "abc");

        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertNull(request.getAttribute(JobUser.REQUEST_ATTRIBUTE));
        assertEquals(request, chain.getRequest());
        assertThrows(UnauthorizedException.class, () -> JobUser.requireAdmin(request));
    }

    @Test
    void doFilter_shouldSkipExecutorApi() throws Exception {
        MockHttpServletRequest request = request("/api/callback");
        request.addHeader(GatewayUserFilter.HEADER_USER_ID, "7");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertNull(request.getAttribute(JobUser.REQUEST_ATTRIBUTE));
    }

    @Test
    void requireAdmin_shouldRejectNonAdminRole() {
        MockHttpServletRequest request = request("/jobgroup/save");
        request.setAttribute(JobUser.REQUEST_ATTRIBUTE, new JobUser(8L, "guest", "USER"));

        assertThrows(ForbiddenException.class, () -> JobUser.requireAdmin(request));
    }

    @Test
    void isExcludedPath_shouldMatchOnlyPublicPrefixes() {
        assertTrue(GatewayUserFilter.isExcludedPath("/api/registry"));
        assertTrue(GatewayUserFilter.isExcludedPath("/actuator/health"));
        assertFalse(GatewayUserFilter.isExcludedPath("/jobinfo/trigger"));
        assertFalse(GatewayUserFilter.isExcludedPath("/apidoc"));
    }
}

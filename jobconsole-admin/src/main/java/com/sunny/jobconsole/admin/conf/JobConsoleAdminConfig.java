package com.sunny.jobconsole.admin.conf;

import com.sunny.jobconsole.core.biz.client.ExecutorBizClient;
import com.sunny.jobconsole.core.enums.RegistryConfig;
import com.sunny.jobconsole.core.util.StringTool;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * jobconsole config
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Component
public class JobConsoleAdminConfig {

    @Value("${jobconsole.job.accessToken:}")
    private String accessToken;

    @Value("${jobconsole.job.timeout:3}")
    private int timeout;

    @Value("${jobconsole.job.registry.deadTimeout:90}")
    private int registryDeadTimeout;

    @Value("${jobconsole.job.timezone:}")
    private String timezone;

    public JobConsoleAdminConfig() {
    }

    public JobConsoleAdminConfig(String accessToken, int timeout, int registryDeadTimeout, String timezone) {
        this.accessToken = accessToken;
        this.timeout = timeout;
        this.registryDeadTimeout = registryDeadTimeout;
        this.timezone = timezone;
    }

    public String getAccessToken() {
        return StringTool.isBlank(accessToken) ? null : accessToken.trim();
    }

    public int getTimeout() {
        return ExecutorBizClient.validTimeout(timeout);
    }

    public int getRegistryDeadTimeout() {
        if (registryDeadTimeout < RegistryConfig.BEAT_TIMEOUT) {
            return RegistryConfig.BEAT_TIMEOUT;
        }
        return registryDeadTimeout;
    }

    public ZoneId getZoneId() {
        if (StringTool.isBlank(timezone)) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timezone.trim());
    }

}

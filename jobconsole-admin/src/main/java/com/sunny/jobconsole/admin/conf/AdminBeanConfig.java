package com.sunny.jobconsole.admin.conf;

import com.sunny.jobconsole.core.cron.ScheduleCalculator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Configuration
public class AdminBeanConfig {

    @Bean
    public Clock clock(JobConsoleAdminConfig adminConfig) {
        return Clock.system(adminConfig.getZoneId());
    }

    @Bean
    public ScheduleCalculator scheduleCalculator(JobConsoleAdminConfig adminConfig) {
        return new ScheduleCalculator(adminConfig.getZoneId());
    }

}

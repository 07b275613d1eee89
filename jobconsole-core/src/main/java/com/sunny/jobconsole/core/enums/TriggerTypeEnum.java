package com.sunny.jobconsole.core.enums;

/**
 * 触发类型
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public enum TriggerTypeEnum {

    MANUAL("Manual trigger"),
    CRON("Cron trigger"),
    API("Api trigger");

    private final String title;

    TriggerTypeEnum(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}

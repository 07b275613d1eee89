package com.sunny.jobconsole.core.enums;

/**
 * 阻塞策略
 * <p>
 * 当任务触发时，执行器上已有实例在运行中的处理策略，由执行器解释
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public enum ExecutorBlockStrategyEnum {

    SERIAL_EXECUTION("单机串行"),
    DISCARD_LATER("丢弃后续调度"),
    COVER_EARLY("覆盖之前调度");

    private final String title;

    ExecutorBlockStrategyEnum(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }

}

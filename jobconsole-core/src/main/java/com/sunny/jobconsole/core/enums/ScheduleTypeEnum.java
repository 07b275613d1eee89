package com.sunny.jobconsole.core.enums;

/**
 * 调度类型
 * <p>
 * FIXED_RATE 与 FIXED_DELAY 使用同一个计算公式，旧版本存储的 FIX_RATE / FIX_DELAY 作为别名识别
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public enum ScheduleTypeEnum {

    NONE("无"),
    CRON("CRON表达式"),
    FIXED_RATE("固定频率", "FIX_RATE"),
    FIXED_DELAY("固定延迟", "FIX_DELAY");

    private final String desc;
    private final String alias;

    ScheduleTypeEnum(String desc) {
        this(desc, null);
    }

    ScheduleTypeEnum(String desc, String alias) {
        this.desc = desc;
        this.alias = alias;
    }

    public String getDesc() {
        return desc;
    }

    /**
     * @param name stored schedule type
     * @return matching type, or null when unknown
     */
    public static ScheduleTypeEnum match(String name) {
        if (name == null) {
            return null;
        }
        String value = name.trim();
        for (ScheduleTypeEnum item : values()) {
            if (item.name().equals(value) || value.equals(item.alias)) {
                return item;
            }
        }
        return null;
    }
}

package com.sunny.jobconsole.core.enums;

/**
 * 执行器地址类型
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public enum AddressTypeEnum {

    AUTO(0, "自动注册"),
    MANUAL(1, "手动录入");

    private final int code;
    private final String desc;

    AddressTypeEnum(int code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    public int getCode() {
        return code;
    }

    public String getDesc() {
        return desc;
    }

    public static AddressTypeEnum of(int code) {
        for (AddressTypeEnum type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return null;
    }
}

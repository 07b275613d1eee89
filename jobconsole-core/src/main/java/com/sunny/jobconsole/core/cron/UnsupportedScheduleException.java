package com.sunny.jobconsole.core.cron;

import com.sunny.jobconsole.core.constant.ErrorType;
import com.sunny.jobconsole.core.exception.BadRequestException;

/**
 * 未知的调度类型
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public class UnsupportedScheduleException extends BadRequestException {

    public UnsupportedScheduleException(String message, Object... args) {
        super(ErrorType.UNSUPPORTED_SCHEDULE, message, args);
    }
}

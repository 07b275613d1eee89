package com.sunny.jobconsole.core.cron;

import com.sunny.jobconsole.core.constant.ErrorType;
import com.sunny.jobconsole.core.exception.BadRequestException;

/**
 * 调度配置无法解析
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public class InvalidScheduleException extends BadRequestException {

    public InvalidScheduleException(String message, Object... args) {
        super(ErrorType.INVALID_SCHEDULE, message, args);
    }
}

package com.sunny.jobconsole.admin.scheduler.exception;

import com.sunny.jobconsole.core.constant.ErrorType;
import com.sunny.jobconsole.core.exception.BadRequestException;

/**
 * No candidate address from override, static list or registry.
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class NoAvailableExecutorException extends BadRequestException {

    public NoAvailableExecutorException(String message, Object... args) {
        super(ErrorType.NO_AVAILABLE_EXECUTOR, message, args);
    }
}

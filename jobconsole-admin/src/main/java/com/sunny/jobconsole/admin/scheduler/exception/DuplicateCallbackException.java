package com.sunny.jobconsole.admin.scheduler.exception;

import com.sunny.jobconsole.core.constant.ErrorType;
import com.sunny.jobconsole.core.exception.ConflictException;

/**
 * The log row already holds a handle result.
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class DuplicateCallbackException extends ConflictException {

    public DuplicateCallbackException(String message, Object... args) {
        super(ErrorType.DUPLICATE_CALLBACK, message, args);
    }
}

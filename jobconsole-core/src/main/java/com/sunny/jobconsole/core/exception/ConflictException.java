package com.sunny.jobconsole.core.exception;

import com.sunny.jobconsole.core.constant.Code;
import com.sunny.jobconsole.core.constant.ErrorType;

/**
 * 状态冲突 (409)
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class ConflictException extends JobConsoleException {

    public ConflictException(String message, Object... args) {
        super(Code.CONFLICT, ErrorType.CONFLICT, message, args);
    }

    public ConflictException(Throwable cause, String message, Object... args) {
        super(cause, Code.CONFLICT, ErrorType.CONFLICT, message, args);
    }

    protected ConflictException(String type, String message, Object... args) {
        super(Code.CONFLICT, type, message, args);
    }
}

package com.sunny.jobconsole.core.exception;

import com.sunny.jobconsole.core.constant.Code;
import com.sunny.jobconsole.core.constant.ErrorType;

/**
 * 内部错误 (500)
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class InternalException extends JobConsoleException {

    public InternalException(String message, Object... args) {
        super(Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, message, args);
    }

    public InternalException(Throwable cause, String message, Object... args) {
        super(cause, Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, message, args);
    }

    protected InternalException(String type, String message, Object... args) {
        super(Code.INTERNAL_ERROR, type, message, args);
    }
}

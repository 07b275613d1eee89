package com.sunny.jobconsole.core.exception;

import com.sunny.jobconsole.core.constant.Code;
import com.sunny.jobconsole.core.constant.ErrorType;

/**
 * 资源不存在 (404)
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class NotFoundException extends JobConsoleException {

    public NotFoundException(String message, Object... args) {
        super(Code.NOT_FOUND, ErrorType.NOT_FOUND, message, args);
    }

    public NotFoundException(Throwable cause, String message, Object... args) {
        super(cause, Code.NOT_FOUND, ErrorType.NOT_FOUND, message, args);
    }

    protected NotFoundException(String type, String message, Object... args) {
        super(Code.NOT_FOUND, type, message, args);
    }
}

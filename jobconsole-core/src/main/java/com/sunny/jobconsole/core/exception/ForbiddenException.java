package com.sunny.jobconsole.core.exception;

import com.sunny.jobconsole.core.constant.Code;
import com.sunny.jobconsole.core.constant.ErrorType;

/**
 * 无权限 (403)
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class ForbiddenException extends JobConsoleException {

    public ForbiddenException(String message, Object... args) {
        super(Code.FORBIDDEN, ErrorType.FORBIDDEN, message, args);
    }

    public ForbiddenException(Throwable cause, String message, Object... args) {
        super(cause, Code.FORBIDDEN, ErrorType.FORBIDDEN, message, args);
    }

    protected ForbiddenException(String type, String message, Object... args) {
        super(Code.FORBIDDEN, type, message, args);
    }
}

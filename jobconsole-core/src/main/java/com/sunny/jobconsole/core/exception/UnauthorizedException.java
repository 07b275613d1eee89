package com.sunny.jobconsole.core.exception;

import com.sunny.jobconsole.core.constant.Code;
import com.sunny.jobconsole.core.constant.ErrorType;

/**
 * 未认证 (401)
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class UnauthorizedException extends JobConsoleException {

    public UnauthorizedException(String message, Object... args) {
        super(Code.UNAUTHORIZED, ErrorType.UNAUTHORIZED, message, args);
    }

    public UnauthorizedException(Throwable cause, String message, Object... args) {
        super(cause, Code.UNAUTHORIZED, ErrorType.UNAUTHORIZED, message, args);
    }

    protected UnauthorizedException(String type, String message, Object... args) {
        super(Code.UNAUTHORIZED, type, message, args);
    }
}

package com.sunny.jobconsole.core.exception;

import com.sunny.jobconsole.core.constant.Code;
import com.sunny.jobconsole.core.constant.ErrorType;

/**
 * 请求参数错误 (400)
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class BadRequestException extends JobConsoleException {

    public BadRequestException(String message, Object... args) {
        super(Code.BAD_REQUEST, ErrorType.BAD_REQUEST, message, args);
    }

    public BadRequestException(Throwable cause, String message, Object... args) {
        super(cause, Code.BAD_REQUEST, ErrorType.BAD_REQUEST, message, args);
    }

    protected BadRequestException(String type, String message, Object... args) {
        super(Code.BAD_REQUEST, type, message, args);
    }
}

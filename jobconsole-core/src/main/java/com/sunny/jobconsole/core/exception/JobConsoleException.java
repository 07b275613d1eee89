package com.sunny.jobconsole.core.exception;

import com.sunny.jobconsole.core.constant.Code;
import com.sunny.jobconsole.core.constant.ErrorType;

/**
 * Base runtime exception of the console.
 * Carries the status code it is rendered with and a type token naming the failure.
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class JobConsoleException extends RuntimeException {

    private final int code;
    private final String type;

    protected JobConsoleException(String message, Object... args) {
        this(Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, null, format(message, args));
    }

    protected JobConsoleException(int code, String type, String message, Object... args) {
        this(code, type, null, format(message, args));
    }

    protected JobConsoleException(Throwable cause, int code, String type, String message, Object... args) {
        this(code, type, cause, format(message, args));
    }

    private JobConsoleException(int code, String type, Throwable cause, String message) {
        super(message, cause);
        this.code = code;
        this.type = type;
    }

    public int getCode() {
        return code;
    }

    public String getType() {
        return type;
    }

    private static String format(String message, Object... args) {
        if (message == null) {
            return "";
        }
        if (args == null || args.length == 0) {
            return message;
        }
        return String.format(message, args);
    }
}

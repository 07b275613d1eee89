package com.sunny.jobconsole.core.constant;

/**
 * Error type tokens, the business meaning of an error travels in the type field
 *
 * @author Sunny
 * @date 2026-02-23
 */
public final class ErrorType {

    public static final String BAD_REQUEST = "BAD_REQUEST";
    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String FORBIDDEN = "FORBIDDEN";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String CONFLICT = "CONFLICT";
    public static final String BAD_GATEWAY = "BAD_GATEWAY";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    public static final String INVALID_SCHEDULE = "INVALID_SCHEDULE";
    public static final String UNSUPPORTED_SCHEDULE = "UNSUPPORTED_SCHEDULE";
    public static final String NO_AVAILABLE_EXECUTOR = "NO_AVAILABLE_EXECUTOR";
    public static final String DUPLICATE_CALLBACK = "DUPLICATE_CALLBACK";
    public static final String DISPATCH_ATTEMPT_FAILED = "DISPATCH_ATTEMPT_FAILED";

    private ErrorType() {
    }
}

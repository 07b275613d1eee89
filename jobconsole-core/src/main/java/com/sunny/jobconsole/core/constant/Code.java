package com.sunny.jobconsole.core.constant;

/**
 * Error codes carried by {@link com.sunny.jobconsole.core.exception.JobConsoleException}.
 * Values follow the HTTP status they are rendered with.
 *
 * @author Sunny
 * @date 2026-02-23
 */
public final class Code {

    public static final int BAD_REQUEST = 400;
    public static final int UNAUTHORIZED = 401;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;
    public static final int INTERNAL_ERROR = 500;
    public static final int BAD_GATEWAY = 502;

    private Code() {
    }
}

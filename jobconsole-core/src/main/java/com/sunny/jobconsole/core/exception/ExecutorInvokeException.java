package com.sunny.jobconsole.core.exception;

import com.sunny.jobconsole.core.constant.Code;
import com.sunny.jobconsole.core.constant.ErrorType;

/**
 * A single call to an executor failed before a well-formed answer came back.
 * <p>
 * Raised by {@link com.sunny.jobconsole.core.biz.client.ExecutorBizClient}, consumed by the dispatch loop
 * which records it and moves on to the next candidate address.
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class ExecutorInvokeException extends JobConsoleException {

    public enum FailureType {
        CONNECT_ERROR,
        TIMEOUT_ERROR,
        REMOTE_STATUS_ERROR,
        DECODE_ERROR
    }

    private final FailureType failureType;
    private final int remoteStatus;

    public ExecutorInvokeException(FailureType failureType, String message, Object... args) {
        this(failureType, 0, null, message, args);
    }

    public ExecutorInvokeException(FailureType failureType, Throwable cause, String message, Object... args) {
        this(failureType, 0, cause, message, args);
    }

    public ExecutorInvokeException(FailureType failureType, int remoteStatus, Throwable cause, String message, Object... args) {
        super(cause, Code.BAD_GATEWAY, ErrorType.DISPATCH_ATTEMPT_FAILED, message, args);
        this.failureType = failureType;
        this.remoteStatus = remoteStatus;
    }

    public FailureType getFailureType() {
        return failureType;
    }

    /**
     * @return HTTP status returned by the executor, 0 unless {@link FailureType#REMOTE_STATUS_ERROR}
     */
    public int getRemoteStatus() {
        return remoteStatus;
    }
}

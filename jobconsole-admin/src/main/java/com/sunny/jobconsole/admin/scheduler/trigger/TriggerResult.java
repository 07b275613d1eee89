package com.sunny.jobconsole.admin.scheduler.trigger;

/**
 * Outcome of one dispatch.
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
public class TriggerResult {

    private final long logId;
    private final int code;
    private final String executorAddress;
    private final String message;

    public TriggerResult(long logId, int code, String executorAddress, String message) {
        this.logId = logId;
        this.code = code;
        this.executorAddress = executorAddress;
        this.message = message;
    }

    public long getLogId() {
        return logId;
    }

    /**
     * 200 when an executor accepted the trigger
     */
    public int getCode() {
        return code;
    }

    /**
     * accepting executor, null unless {@link #getCode()} is 200
     */
    public String getExecutorAddress() {
        return executorAddress;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "TriggerResult{" +
                "logId=" + logId +
                ", code=" + code +
                ", executorAddress='" + executorAddress + '\'' +
                ", message='" + message + '\'' +
                '}';
    }
}

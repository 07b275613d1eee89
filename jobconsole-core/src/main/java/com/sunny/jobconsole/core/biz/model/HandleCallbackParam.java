package com.sunny.jobconsole.core.biz.model;

import com.google.gson.annotations.SerializedName;

import java.io.Serializable;

/**
 * One completion report sent by an executor.
 * Older executors spell the time field {@code logDateTim}, both keys are read.
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
public class HandleCallbackParam implements Serializable {
    private static final long serialVersionUID = 42L;

    private long logId;
    @SerializedName(value = "logDateTime", alternate = {"logDateTim"})
    private long logDateTime;

    private int handleCode;
    private String handleMsg;

    public HandleCallbackParam(){}
    public HandleCallbackParam(long logId, long logDateTime, int handleCode, String handleMsg) {
        this.logId = logId;
        this.logDateTime = logDateTime;
        this.handleCode = handleCode;
        this.handleMsg = handleMsg;
    }

    public long getLogId() {
        return logId;
    }

    public void setLogId(long logId) {
        this.logId = logId;
    }

    public long getLogDateTime() {
        return logDateTime;
    }

    public void setLogDateTime(long logDateTime) {
        this.logDateTime = logDateTime;
    }

    public int getHandleCode() {
        return handleCode;
    }

    public void setHandleCode(int handleCode) {
        this.handleCode = handleCode;
    }

    public String getHandleMsg() {
        return handleMsg;
    }

    public void setHandleMsg(String handleMsg) {
        this.handleMsg = handleMsg;
    }

    @Override
    public String toString() {
        return "HandleCallbackParam{" +
                "logId=" + logId +
                ", logDateTime=" + logDateTime +
                ", handleCode=" + handleCode +
                ", handleMsg='" + handleMsg + '\'' +
                '}';
    }

}

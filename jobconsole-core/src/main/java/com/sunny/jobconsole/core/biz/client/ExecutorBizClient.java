package com.sunny.jobconsole.core.biz.client;

import com.sunny.jobconsole.core.biz.ExecutorBiz;
import com.sunny.jobconsole.core.biz.model.LogParam;
import com.sunny.jobconsole.core.biz.model.LogResult;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.biz.model.TriggerParam;
import com.sunny.jobconsole.core.util.JobRemotingUtil;

/**
 * executor api client
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
public class ExecutorBizClient implements ExecutorBiz {

    public static final int DEFAULT_TIMEOUT = 3;
    public static final int MIN_TIMEOUT = 1;
    public static final int MAX_TIMEOUT = 10;

    public ExecutorBizClient(String addressUrl, String accessToken, int timeout) {
        String address = addressUrl == null ? "" : addressUrl.trim();
        this.addressUrl = address.endsWith("/") ? address : address + "/";
        this.accessToken = accessToken;
        this.timeout = validTimeout(timeout);
    }

    private final String addressUrl;
    private final String accessToken;
    private final int timeout;

    /**
     * {@code <= 0} means default, anything else is clamped to [1, 10] seconds
     */
    public static int validTimeout(int timeout) {
        if (timeout <= 0) {
            return DEFAULT_TIMEOUT;
        }
        return Math.max(MIN_TIMEOUT, Math.min(MAX_TIMEOUT, timeout));
    }

    public String getAddressUrl() {
        return addressUrl;
    }

    public int getTimeout() {
        return timeout;
    }

    @Override
    public ReturnT<String> run(TriggerParam triggerParam) {
        return JobRemotingUtil.postBody(addressUrl + "run", accessToken, timeout, triggerParam, String.class);
    }

    @Override
    public ReturnT<LogResult> log(LogParam logParam) {
        return JobRemotingUtil.postBody(addressUrl + "log", accessToken, timeout, logParam, LogResult.class);
    }

}

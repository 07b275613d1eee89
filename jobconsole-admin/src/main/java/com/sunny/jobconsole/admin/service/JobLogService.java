package com.sunny.jobconsole.admin.service;

import com.sunny.jobconsole.core.biz.model.LogResult;
import com.sunny.jobconsole.core.biz.model.ReturnT;

/**
 * 调度日志
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
public interface JobLogService {

    /**
     * execution log read from the executor, or a trigger/handle summary when the executor cannot serve it
     */
    ReturnT<LogResult> logDetailCat(long logId, int fromLineNum);

    ReturnT<String> kill(long logId, String operator);
}

package com.sunny.jobconsole.core.biz;

import com.sunny.jobconsole.core.biz.model.LogParam;
import com.sunny.jobconsole.core.biz.model.LogResult;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.biz.model.TriggerParam;

/**
 * Calls the console makes on an executor.
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
public interface ExecutorBiz {

    /**
     * run
     *
     * @param triggerParam
     * @return executor answer, {@code code == 200} when the trigger is accepted
     * @throws com.sunny.jobconsole.core.exception.ExecutorInvokeException when no well-formed answer came back
     */
    public ReturnT<String> run(TriggerParam triggerParam);

    /**
     * log
     *
     * @param logParam
     * @return
     * @throws com.sunny.jobconsole.core.exception.ExecutorInvokeException when no well-formed answer came back
     */
    public ReturnT<LogResult> log(LogParam logParam);

}

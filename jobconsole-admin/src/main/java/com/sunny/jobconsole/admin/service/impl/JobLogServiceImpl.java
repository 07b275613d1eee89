package com.sunny.jobconsole.admin.service.impl;

import com.sunny.jobconsole.admin.mapper.JobLogMapper;
import com.sunny.jobconsole.admin.model.JobLog;
import com.sunny.jobconsole.admin.scheduler.ExecutorBizRepository;
import com.sunny.jobconsole.admin.scheduler.complete.JobCompleter;
import com.sunny.jobconsole.admin.service.JobLogService;
import com.sunny.jobconsole.core.biz.model.LogParam;
import com.sunny.jobconsole.core.biz.model.LogResult;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.exception.ExecutorInvokeException;
import com.sunny.jobconsole.core.exception.NotFoundException;
import com.sunny.jobconsole.core.util.StringTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 调度日志
 * <p>
 * 执行日志保存在执行器本地，调度中心只负责转发；执行器不可用时返回调度/回调信息摘要
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Service
public class JobLogServiceImpl implements JobLogService {
    private static final Logger logger = LoggerFactory.getLogger(JobLogServiceImpl.class);

    private final JobLogMapper jobLogMapper;
    private final ExecutorBizRepository executorBizRepository;
    private final JobCompleter jobCompleter;

    public JobLogServiceImpl(JobLogMapper jobLogMapper,
                             ExecutorBizRepository executorBizRepository,
                             JobCompleter jobCompleter) {
        this.jobLogMapper = jobLogMapper;
        this.executorBizRepository = executorBizRepository;
        this.jobCompleter = jobCompleter;
    }

    @Override
    public ReturnT<LogResult> logDetailCat(long logId, int fromLineNum) {
        JobLog jobLog = jobLogMapper.load(logId);
        if (jobLog == null) {
            throw new NotFoundException("log item not found.");
        }
        int from = Math.max(1, fromLineNum);

        if (jobLog.getTriggerCode() != ReturnT.SUCCESS_CODE && jobLog.getHandleCode() == 0) {
            return ReturnT.ofSuccess(summary(jobLog, from, "dispatch failed, executor log unavailable"));
        }
        if (StringTool.isBlank(jobLog.getExecutorAddress())) {
            return ReturnT.ofSuccess(summary(jobLog, from, "executor address unknown"));
        }
        if (jobLog.getTriggerTime() == null) {
            return ReturnT.ofSuccess(summary(jobLog, from, "trigger time unknown"));
        }

        LogParam logParam = new LogParam(jobLog.getTriggerTime().getTime(), logId, from);
        ReturnT<LogResult> result;
        try {
            result = executorBizRepository.getExecutorBiz(jobLog.getExecutorAddress()).log(logParam);
        } catch (ExecutorInvokeException e) {
            logger.warn(">>>>>>>>>>> jobconsole log cat failed, logId:{}, address:{}, type:{}, msg:{}",
                    logId, jobLog.getExecutorAddress(), e.getFailureType(), e.getMessage());
            return ReturnT.ofSuccess(summary(jobLog, from, e.getMessage()));
        }

        if (!result.isSuccess()) {
            String reason = StringTool.isBlank(result.getMsg()) ? "executor returned failure" : result.getMsg();
            return ReturnT.ofSuccess(summary(jobLog, from, reason));
        }
        if (result.getContent() == null) {
            return ReturnT.ofSuccess(summary(jobLog, from, "executor returned no log content"));
        }
        return ReturnT.ofSuccess(result.getContent());
    }

    @Override
    public ReturnT<String> kill(long logId, String operator) {
        jobCompleter.kill(logId, operator);
        return ReturnT.ofSuccess();
    }

    static LogResult summary(JobLog jobLog, int fromLineNum, String reason) {
        StringBuilder content = new StringBuilder();
        content.append("Trigger log:\n").append(nullToEmpty(jobLog.getTriggerMsg()))
                .append("\nHandle log:\n").append(nullToEmpty(jobLog.getHandleMsg()));
        if (content.charAt(content.length() - 1) != '\n') {
            content.append('\n');
        }
        content.append("\nNote: ").append(reason);

        String logContent = content.toString();
        return new LogResult(fromLineNum, logContent.split("\n").length, logContent, true);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

}

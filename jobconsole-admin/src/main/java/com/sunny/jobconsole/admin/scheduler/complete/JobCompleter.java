package com.sunny.jobconsole.admin.scheduler.complete;

import com.sunny.jobconsole.admin.mapper.JobLogMapper;
import com.sunny.jobconsole.admin.model.JobLog;
import com.sunny.jobconsole.admin.scheduler.exception.DuplicateCallbackException;
import com.sunny.jobconsole.core.biz.model.HandleCallbackParam;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.exception.BadRequestException;
import com.sunny.jobconsole.core.exception.JobConsoleException;
import com.sunny.jobconsole.core.exception.NotFoundException;
import com.sunny.jobconsole.core.util.StringTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Date;
import java.util.List;

/**
 * Records executor callbacks on their log rows, each row accepts exactly one handle result.
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Component
public class JobCompleter {
    private static final Logger logger = LoggerFactory.getLogger(JobCompleter.class);

    // text最大64kb 避免长度过长
    public static final int HANDLE_MSG_MAX_LENGTH = 15000;

    static final String KILL_MSG = "Killed by operator %s";

    private final JobLogMapper jobLogMapper;
    private final Clock clock;

    public JobCompleter(JobLogMapper jobLogMapper, Clock clock) {
        this.jobLogMapper = jobLogMapper;
        this.clock = clock;
    }

    /**
     * callback batch, items are independent of each other
     */
    public ReturnT<String> callback(List<HandleCallbackParam> callbackParamList) {
        if (callbackParamList == null) {
            return ReturnT.ofSuccess();
        }
        for (HandleCallbackParam handleCallbackParam : callbackParamList) {
            if (handleCallbackParam == null) {
                continue;
            }
            try {
                reconcile(handleCallbackParam);
            } catch (JobConsoleException e) {
                logger.warn(">>>>>>>>>>> jobconsole callback rejected, logId:{}, msg:{}", handleCallbackParam.getLogId(), e.getMessage());
            } catch (Exception e) {
                logger.error(">>>>>>>>>>> jobconsole callback error, logId:" + handleCallbackParam.getLogId(), e);
            }
        }
        return ReturnT.ofSuccess();
    }

    /**
     * common fresh handle entrance (limit only once)
     *
     * @throws NotFoundException          log row missing
     * @throws DuplicateCallbackException log row already has a handle result
     * @throws BadRequestException        reported code is 0, which only marks a pending row
     */
    public void reconcile(HandleCallbackParam handleCallbackParam) {
        JobLog log = jobLogMapper.load(handleCallbackParam.getLogId());
        if (log == null) {
            throw new NotFoundException("log item not found.");
        }
        if (log.getHandleCode() != 0) {
            throw new DuplicateCallbackException("log repeate callback.");
        }
        if (handleCallbackParam.getHandleCode() == 0) {
            throw new BadRequestException("invalid handle code: %s", handleCallbackParam.getHandleCode());
        }

        finish(log, handleCallbackParam.getHandleCode(), handleCallbackParam.getHandleMsg());
        logger.debug(">>>>>>>>>>> jobconsole callback success, logId:{}, handleCode:{}", log.getId(), log.getHandleCode());
    }

    /**
     * 人工终止：将未完成的日志标记为失败，并在执行日志后追加操作人
     *
     * @throws NotFoundException          log row missing
     * @throws BadRequestException        the run already succeeded
     * @throws DuplicateCallbackException the run already has another handle result
     */
    public void kill(long logId, String operator) {
        JobLog log = jobLogMapper.load(logId);
        if (log == null) {
            throw new NotFoundException("log item not found.");
        }
        if (log.getHandleCode() == ReturnT.SUCCESS_CODE) {
            throw new BadRequestException("task already finished.");
        }
        if (log.getHandleCode() != 0) {
            throw new DuplicateCallbackException("log already handled, handleCode: %s", log.getHandleCode());
        }

        finish(log, ReturnT.FAIL_CODE, String.format(KILL_MSG, operator == null ? "" : operator.trim()));
        logger.info(">>>>>>>>>>> jobconsole log killed, logId:{}, operator:{}", logId, operator);
    }

    private void finish(JobLog log, int handleCode, String incomingMsg) {
        String handleMsg = mergeHandleMsg(log.getHandleMsg(), incomingMsg);

        log.setHandleTime(new Date(clock.millis()));
        log.setHandleCode(handleCode);
        log.setHandleMsg(StringTool.truncate(handleMsg, HANDLE_MSG_MAX_LENGTH));

        // the pending guard is part of the update, a concurrent writer leaves 0 rows
        if (jobLogMapper.updateHandleInfoIfPending(log) < 1) {
            throw new DuplicateCallbackException("log repeate callback.");
        }
    }

    private static String mergeHandleMsg(String existing, String incoming) {
        StringBuilder handleMsg = new StringBuilder();
        if (StringTool.isNotBlank(existing)) {
            handleMsg.append(existing).append("\n");
        }
        if (StringTool.isNotBlank(incoming)) {
            handleMsg.append(incoming.trim());
        }
        return handleMsg.toString();
    }

}

package com.sunny.jobconsole.admin.scheduler.trigger;

import com.sunny.jobconsole.admin.mapper.JobGroupMapper;
import com.sunny.jobconsole.admin.mapper.JobInfoMapper;
import com.sunny.jobconsole.admin.mapper.JobLogMapper;
import com.sunny.jobconsole.admin.model.JobGroup;
import com.sunny.jobconsole.admin.model.JobInfo;
import com.sunny.jobconsole.admin.model.JobLog;
import com.sunny.jobconsole.admin.scheduler.ExecutorBizRepository;
import com.sunny.jobconsole.admin.scheduler.route.ExecutorAddressResolver;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.biz.model.TriggerParam;
import com.sunny.jobconsole.core.cron.ScheduleCalculator;
import com.sunny.jobconsole.core.enums.ExecutorBlockStrategyEnum;
import com.sunny.jobconsole.core.enums.TriggerTypeEnum;
import com.sunny.jobconsole.core.exception.ExecutorInvokeException;
import com.sunny.jobconsole.core.exception.InternalException;
import com.sunny.jobconsole.core.exception.JobConsoleException;
import com.sunny.jobconsole.core.exception.NotFoundException;
import com.sunny.jobconsole.core.util.DateUtil;
import com.sunny.jobconsole.core.util.StringTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * dispatch one trigger of a job
 * <p>
 * load job and group, resolve candidates, write the pending log row, try candidates in order until one
 * answers code 200, then record the trace on the log row and the trigger times on the job.
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Component
public class JobTrigger {
    private static final Logger logger = LoggerFactory.getLogger(JobTrigger.class);

    public static final String MSG_SEPARATOR = "<br>";

    private final JobInfoMapper jobInfoMapper;
    private final JobGroupMapper jobGroupMapper;
    private final JobLogMapper jobLogMapper;
    private final ExecutorAddressResolver addressResolver;
    private final ExecutorBizRepository executorBizRepository;
    private final ScheduleCalculator scheduleCalculator;
    private final Clock clock;

    public JobTrigger(JobInfoMapper jobInfoMapper,
                      JobGroupMapper jobGroupMapper,
                      JobLogMapper jobLogMapper,
                      ExecutorAddressResolver addressResolver,
                      ExecutorBizRepository executorBizRepository,
                      ScheduleCalculator scheduleCalculator,
                      Clock clock) {
        this.jobInfoMapper = jobInfoMapper;
        this.jobGroupMapper = jobGroupMapper;
        this.jobLogMapper = jobLogMapper;
        this.addressResolver = addressResolver;
        this.executorBizRepository = executorBizRepository;
        this.scheduleCalculator = scheduleCalculator;
        this.clock = clock;
    }

    /**
     * trigger job
     *
     * @param jobId
     * @param triggerType
     * @param executorParam   null or blank: use the job's own param
     * @param addressList     null: resolve from group and registry
     * @param operator        shown in the trigger message
     * @return dispatch outcome, also when every candidate failed
     */
    public TriggerResult trigger(int jobId,
                                 TriggerTypeEnum triggerType,
                                 String executorParam,
                                 String addressList,
                                 String operator) {

        // load data
        JobInfo jobInfo = jobInfoMapper.loadById(jobId);
        if (jobInfo == null) {
            throw new NotFoundException("job not found, jobId=%s", jobId);
        }
        JobGroup group = jobGroupMapper.load(jobInfo.getJobGroup());
        if (group == null) {
            throw new NotFoundException("executor group not found, jobGroup=%s", jobInfo.getJobGroup());
        }

        // candidates, no log row when nothing is available
        List<String> addresses = addressResolver.resolve(group, addressList);

        // 1、save log, before any network call
        Date triggerTime = new Date(clock.millis());
        String param = StringTool.isNotBlank(executorParam) ? executorParam.trim() : jobInfo.getExecutorParam();

        JobLog jobLog = new JobLog();
        jobLog.setJobGroup(jobInfo.getJobGroup());
        jobLog.setJobId(jobInfo.getId());
        jobLog.setExecutorHandler(StringTool.isBlank(jobInfo.getExecutorHandler()) ? null : jobInfo.getExecutorHandler());
        jobLog.setExecutorParam(param);
        jobLog.setExecutorFailRetryCount(jobInfo.getExecutorFailRetryCount());
        jobLog.setTriggerTime(triggerTime);
        jobLog.setTriggerCode(0);
        jobLog.setHandleCode(0);
        jobLogMapper.save(jobLog);
        if (jobLog.getId() <= 0) {
            throw new InternalException("job log id not generated, jobId=%s", jobId);
        }
        logger.debug(">>>>>>>>>>> jobconsole trigger start, jobId:{}, logId:{}", jobId, jobLog.getId());

        // 2、init trigger-param
        TriggerParam triggerParam = buildTriggerParam(jobInfo, jobLog, param);

        // 3、attempt candidates in order
        List<String> lines = new ArrayList<>();
        lines.add("Trigger type: " + triggerType.getTitle() + ", operator: " + (operator == null ? "-" : operator));
        lines.add("Candidate executors: " + String.join(", ", addresses));

        int finalCode = ReturnT.FAIL_CODE;
        String finalMsg = null;
        String finalAddress = null;
        for (String address : addresses) {
            try {
                ReturnT<String> result = executorBizRepository.getExecutorBiz(address).run(triggerParam);
                lines.add(attemptLine(address, result));
                finalCode = result.getCode();
                finalMsg = result.getMsg();
                if (result.getCode() == ReturnT.SUCCESS_CODE) {
                    finalAddress = address;
                    logger.info(">>>>>>>>>>> jobconsole trigger success, jobId:{}, logId:{}, address:{}", jobId, jobLog.getId(), address);
                    break;
                }
                logger.warn(">>>>>>>>>>> jobconsole trigger rejected, jobId:{}, logId:{}, address:{}, code:{}, msg:{}",
                        jobId, jobLog.getId(), address, result.getCode(), result.getMsg());
            } catch (ExecutorInvokeException e) {
                lines.add("Call executor `" + address + "` failed: " + e.getFailureType() + ", " + e.getMessage());
                logger.warn(">>>>>>>>>>> jobconsole trigger attempt failed, jobId:{}, logId:{}, address:{}, type:{}, msg:{}",
                        jobId, jobLog.getId(), address, e.getFailureType(), e.getMessage());
            }
        }
        if (finalAddress == null) {
            lines.add("All candidate executors failed");
            logger.error(">>>>>>>>>>> jobconsole trigger fail, all candidates failed, jobId:{}, logId:{}", jobId, jobLog.getId());
        }

        // 4、update log trigger-info
        jobLog.setExecutorAddress(finalAddress);
        jobLog.setTriggerCode(finalCode);
        jobLog.setTriggerMsg(String.join(MSG_SEPARATOR, lines));
        jobLogMapper.updateTriggerInfo(jobLog);

        // 5、job trigger bookkeeping
        long now = triggerTime.getTime();
        jobInfoMapper.updateTriggerTime(jobInfo.getId(), now, nextTriggerTime(jobInfo, now));

        String message;
        if (finalCode == ReturnT.SUCCESS_CODE) {
            message = "trigger success";
        } else if (StringTool.isNotBlank(finalMsg)) {
            message = "trigger fail: " + finalMsg;
        } else {
            message = "trigger fail";
        }
        logger.info(">>>>>>>>>>> jobconsole trigger end, jobId:{}, logId:{}, code:{}", jobId, jobLog.getId(), finalCode);
        return new TriggerResult(jobLog.getId(), finalCode, finalAddress, message);
    }

    private Long nextTriggerTime(JobInfo jobInfo, long now) {
        try {
            Optional<Long> next = scheduleCalculator.next(jobInfo.getScheduleType(), jobInfo.getScheduleConf(), now);
            return next.orElse(null);
        } catch (JobConsoleException e) {
            logger.warn(">>>>>>>>>>> jobconsole stored schedule invalid, keep next trigger time, jobId:{}, scheduleType:{}, scheduleConf:{}, msg:{}",
                    jobInfo.getId(), jobInfo.getScheduleType(), jobInfo.getScheduleConf(), e.getMessage());
            return null;
        }
    }

    private static TriggerParam buildTriggerParam(JobInfo jobInfo, JobLog jobLog, String param) {
        TriggerParam triggerParam = new TriggerParam();
        triggerParam.setJobId(jobInfo.getId());
        triggerParam.setExecutorHandler(jobInfo.getExecutorHandler() == null ? "" : jobInfo.getExecutorHandler());
        triggerParam.setExecutorParams(param == null ? "" : param);
        // unknown strategies are the executor's to interpret
        triggerParam.setExecutorBlockStrategy(StringTool.isBlank(jobInfo.getExecutorBlockStrategy())
                ? ExecutorBlockStrategyEnum.SERIAL_EXECUTION.name()
                : jobInfo.getExecutorBlockStrategy().trim());
        triggerParam.setExecutorTimeout(jobInfo.getExecutorTimeout());
        triggerParam.setLogId(jobLog.getId());
        triggerParam.setLogDateTime(jobLog.getTriggerTime().getTime());
        triggerParam.setGlueType(jobInfo.getGlueType() == null ? "" : jobInfo.getGlueType());
        triggerParam.setGlueSource(jobInfo.getGlueSource() == null ? "" : jobInfo.getGlueSource());
        triggerParam.setGlueUpdatetime(DateUtil.toEpochMilli(jobInfo.getGlueUpdatetime()));
        triggerParam.setBroadcastIndex(0);
        triggerParam.setBroadcastTotal(1);
        return triggerParam;
    }

    private static String attemptLine(String address, ReturnT<String> result) {
        StringBuilder line = new StringBuilder();
        line.append("Executor `").append(address).append("` returned code = ").append(result.getCode());
        if (StringTool.isNotBlank(result.getMsg())) {
            line.append(", msg = ").append(result.getMsg());
        }
        if (StringTool.isNotBlank(result.getContent())) {
            line.append(", content = ").append(result.getContent());
        }
        return line.toString();
    }

}

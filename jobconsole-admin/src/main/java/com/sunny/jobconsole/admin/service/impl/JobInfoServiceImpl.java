package com.sunny.jobconsole.admin.service.impl;

import com.sunny.jobconsole.admin.mapper.JobInfoMapper;
import com.sunny.jobconsole.admin.model.JobInfo;
import com.sunny.jobconsole.admin.scheduler.trigger.JobTrigger;
import com.sunny.jobconsole.admin.scheduler.trigger.TriggerResult;
import com.sunny.jobconsole.admin.service.JobInfoService;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.cron.ScheduleCalculator;
import com.sunny.jobconsole.core.enums.TriggerTypeEnum;
import com.sunny.jobconsole.core.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * core job action for jobconsole
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Service
public class JobInfoServiceImpl implements JobInfoService {
	private static final Logger logger = LoggerFactory.getLogger(JobInfoServiceImpl.class);

	public static final int PREVIEW_COUNT = 5;

	private final JobInfoMapper jobInfoMapper;
	private final JobTrigger jobTrigger;
	private final ScheduleCalculator scheduleCalculator;
	private final Clock clock;

	public JobInfoServiceImpl(JobInfoMapper jobInfoMapper, JobTrigger jobTrigger, ScheduleCalculator scheduleCalculator, Clock clock) {
		this.jobInfoMapper = jobInfoMapper;
		this.jobTrigger = jobTrigger;
		this.scheduleCalculator = scheduleCalculator;
		this.clock = clock;
	}

	@Override
	public ReturnT<String> trigger(int id, String executorParam, String addressList, String operator) {
		TriggerResult result = jobTrigger.trigger(id, TriggerTypeEnum.MANUAL, executorParam, addressList, operator);
		return ReturnT.of(result.getCode(), result.getMessage(), String.valueOf(result.getLogId()));
	}

	@Override
	public ReturnT<String> start(int id) {
		JobInfo jobInfo = loadJob(id);

		long now = clock.millis();
		long nextTriggerTime = scheduleCalculator.next(jobInfo.getScheduleType(), jobInfo.getScheduleConf(), now).orElse(0L);

		jobInfoMapper.updateTriggerStatus(id, 1, now, nextTriggerTime);
		logger.info(">>>>>>>>>>> jobconsole job start, jobId:{}, nextTriggerTime:{}", id, nextTriggerTime);
		return ReturnT.ofSuccess();
	}

	@Override
	public ReturnT<String> stop(int id) {
		JobInfo jobInfo = loadJob(id);

		jobInfoMapper.updateTriggerStatus(id, 0, jobInfo.getTriggerLastTime(), 0);
		logger.info(">>>>>>>>>>> jobconsole job stop, jobId:{}", id);
		return ReturnT.ofSuccess();
	}

	@Override
	public ReturnT<List<Long>> nextTriggerTime(String scheduleType, String scheduleConf) {
		return ReturnT.ofSuccess(scheduleCalculator.nextTimes(scheduleType, scheduleConf, clock.millis(), PREVIEW_COUNT));
	}

	private JobInfo loadJob(int id) {
		JobInfo jobInfo = jobInfoMapper.loadById(id);
		if (jobInfo == null) {
			throw new NotFoundException("job not found, jobId=%s", id);
		}
		return jobInfo;
	}

}

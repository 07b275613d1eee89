package com.sunny.jobconsole.admin.controller.biz;

import com.sunny.jobconsole.admin.security.JobUser;
import com.sunny.jobconsole.admin.service.JobInfoService;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.cron.ScheduleCalculator;
import com.sunny.jobconsole.core.util.DateUtil;
import jakarta.annotation.Resource;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.ArrayList;
import java.util.List;

/**
 * index controller
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Controller
@RequestMapping("/jobinfo")
public class JobInfoController {
	private static Logger logger = LoggerFactory.getLogger(JobInfoController.class);

	@Resource
	private JobInfoService jobInfoService;
	@Resource
	private ScheduleCalculator scheduleCalculator;

	@PostMapping("/trigger")
	@ResponseBody
	public ReturnT<String> triggerJob(HttpServletRequest request,
									  @RequestParam("id") int id,
									  @RequestParam(value = "executorParam", required = false) String executorParam,
									  @RequestParam(value = "addressList", required = false) String addressList) {
		JobUser jobUser = JobUser.requireAdmin(request);
		logger.info(">>>>>>>>>>> jobconsole manual trigger, jobId:{}, operator:{}", id, jobUser.getUsername());
		return jobInfoService.trigger(id, executorParam, addressList, jobUser.getUsername());
	}

	@PostMapping("/start")
	@ResponseBody
	public ReturnT<String> start(HttpServletRequest request, @RequestParam("id") int id) {
		JobUser.requireAdmin(request);
		return jobInfoService.start(id);
	}

	@PostMapping("/stop")
	@ResponseBody
	public ReturnT<String> pause(HttpServletRequest request, @RequestParam("id") int id) {
		JobUser.requireAdmin(request);
		return jobInfoService.stop(id);
	}

	@GetMapping("/nextTriggerTime")
	@ResponseBody
	public ReturnT<List<String>> nextTriggerTime(@RequestParam("scheduleType") String scheduleType,
												 @RequestParam(value = "scheduleConf", required = false) String scheduleConf) {
		List<Long> nextTimes = jobInfoService.nextTriggerTime(scheduleType, scheduleConf).getContent();

		List<String> result = new ArrayList<>();
		for (Long item : nextTimes) {
			result.add(DateUtil.formatDateTime(item, scheduleCalculator.getZoneId()));
		}
		return ReturnT.ofSuccess(result);
	}

}

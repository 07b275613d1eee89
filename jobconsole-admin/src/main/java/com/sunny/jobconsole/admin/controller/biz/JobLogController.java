package com.sunny.jobconsole.admin.controller.biz;

import com.sunny.jobconsole.admin.security.JobUser;
import com.sunny.jobconsole.admin.service.JobLogService;
import com.sunny.jobconsole.core.biz.model.LogResult;
import com.sunny.jobconsole.core.biz.model.ReturnT;
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

/**
 * job log controller
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Controller
@RequestMapping("/joblog")
public class JobLogController {
	private static Logger logger = LoggerFactory.getLogger(JobLogController.class);

	@Resource
	private JobLogService jobLogService;

	@GetMapping("/logDetailCat")
	@ResponseBody
	public ReturnT<LogResult> logDetailCat(HttpServletRequest request,
										   @RequestParam("id") long id,
										   @RequestParam(value = "fromLineNum", required = false, defaultValue = "1") int fromLineNum) {
		JobUser.requireLogin(request);
		return jobLogService.logDetailCat(id, fromLineNum);
	}

	@PostMapping("/logKill")
	@ResponseBody
	public ReturnT<String> logKill(HttpServletRequest request, @RequestParam("id") long id) {
		JobUser jobUser = JobUser.requireAdmin(request);
		logger.info(">>>>>>>>>>> jobconsole log kill, logId:{}, operator:{}", id, jobUser.getUsername());
		return jobLogService.kill(id, jobUser.getUsername());
	}

}

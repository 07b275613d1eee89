package com.sunny.jobconsole.admin.controller.biz;

import com.sunny.jobconsole.admin.model.JobGroup;
import com.sunny.jobconsole.admin.security.JobUser;
import com.sunny.jobconsole.admin.service.JobGroupService;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import jakarta.annotation.Resource;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.List;

/**
 * job group controller
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Controller
@RequestMapping("/jobgroup")
public class JobGroupController {

	@Resource
	private JobGroupService jobGroupService;

	@GetMapping("/list")
	@ResponseBody
	public ReturnT<List<JobGroup>> list() {
		return jobGroupService.list();
	}

	@GetMapping("/loadById")
	@ResponseBody
	public ReturnT<JobGroup> loadById(@RequestParam("id") int id) {
		return jobGroupService.load(id);
	}

	@PostMapping("/save")
	@ResponseBody
	public ReturnT<String> save(HttpServletRequest request, JobGroup jobGroup) {
		JobUser.requireAdmin(request);
		return jobGroupService.save(jobGroup);
	}

	@PostMapping("/update")
	@ResponseBody
	public ReturnT<String> update(HttpServletRequest request, JobGroup jobGroup) {
		JobUser.requireAdmin(request);
		return jobGroupService.update(jobGroup);
	}

	@PostMapping("/remove")
	@ResponseBody
	public ReturnT<String> remove(HttpServletRequest request, @RequestParam("id") int id) {
		JobUser.requireAdmin(request);
		return jobGroupService.remove(id);
	}

}

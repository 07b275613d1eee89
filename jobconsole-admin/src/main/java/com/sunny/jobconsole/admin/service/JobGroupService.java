package com.sunny.jobconsole.admin.service;

import com.sunny.jobconsole.admin.model.JobGroup;
import com.sunny.jobconsole.core.biz.model.ReturnT;

import java.util.List;

/**
 * 执行器分组管理
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
public interface JobGroupService {

    ReturnT<List<JobGroup>> list();

    ReturnT<JobGroup> load(int id);

    ReturnT<String> save(JobGroup jobGroup);

    ReturnT<String> update(JobGroup jobGroup);

    ReturnT<String> remove(int id);
}

package com.sunny.jobconsole.admin.service;

import com.sunny.jobconsole.core.biz.model.ReturnT;

import java.util.List;

/**
 * core job action for jobconsole
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
public interface JobInfoService {

	/**
	 * manual trigger
	 *
	 * @param id
	 * @param executorParam overrides the job param when not blank
	 * @param addressList   overrides address resolution when it yields addresses
	 * @param operator
	 * @return code is the dispatch code, content is the log id
	 */
	public ReturnT<String> trigger(int id, String executorParam, String addressList, String operator);

	/**
	 * start job
	 *
	 * @param id
	 * @return
	 */
	public ReturnT<String> start(int id);

	/**
	 * stop job
	 *
	 * @param id
	 * @return
	 */
	public ReturnT<String> stop(int id);

	/**
	 * next fire times from now
	 *
	 * @return up to 5 epoch millis
	 */
	public ReturnT<List<Long>> nextTriggerTime(String scheduleType, String scheduleConf);

}

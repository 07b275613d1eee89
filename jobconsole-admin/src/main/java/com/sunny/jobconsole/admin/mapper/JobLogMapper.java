package com.sunny.jobconsole.admin.mapper;

import com.sunny.jobconsole.admin.model.JobLog;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * job log
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Mapper
public interface JobLogMapper {

	public JobLog load(@Param("id") long id);

	public long save(JobLog jobLog);

	public int updateTriggerInfo(JobLog jobLog);

	/**
	 * write the handle result only while handle_code is still 0
	 *
	 * @return 0 when another callback already landed
	 */
	public int updateHandleInfoIfPending(JobLog jobLog);

}

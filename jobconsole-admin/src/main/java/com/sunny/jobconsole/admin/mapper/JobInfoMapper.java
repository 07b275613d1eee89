package com.sunny.jobconsole.admin.mapper;

import com.sunny.jobconsole.admin.model.JobInfo;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * job info
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Mapper
public interface JobInfoMapper {

	public JobInfo loadById(@Param("id") int id);

	public int countByGroup(@Param("jobGroup") int jobGroup);

	/**
	 * trigger bookkeeping after a dispatch, only names trigger_last_time and trigger_next_time
	 *
	 * @param triggerNextTime null keeps the stored value
	 */
	public int updateTriggerTime(@Param("id") int id,
								 @Param("triggerLastTime") long triggerLastTime,
								 @Param("triggerNextTime") Long triggerNextTime);

	public int updateTriggerStatus(@Param("id") int id,
								   @Param("triggerStatus") int triggerStatus,
								   @Param("triggerLastTime") long triggerLastTime,
								   @Param("triggerNextTime") long triggerNextTime);

}

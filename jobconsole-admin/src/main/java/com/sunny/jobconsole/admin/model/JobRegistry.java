package com.sunny.jobconsole.admin.model;

import java.util.Date;

/**
 * one heartbeat row: (group, key, value) plus last beat time
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
public class JobRegistry {

	private int id;
	private String registryGroup;	// EXECUTOR
	private String registryKey;		// executor appname
	private String registryValue;	// executor address
	private Date updateTime;		// last heartbeat

	public int getId() {
		return id;
	}

	public void setId(int id) {
		this.id = id;
	}

	public String getRegistryGroup() {
		return registryGroup;
	}

	public void setRegistryGroup(String registryGroup) {
		this.registryGroup = registryGroup;
	}

	public String getRegistryKey() {
		return registryKey;
	}

	public void setRegistryKey(String registryKey) {
		this.registryKey = registryKey;
	}

	public String getRegistryValue() {
		return registryValue;
	}

	public void setRegistryValue(String registryValue) {
		this.registryValue = registryValue;
	}

	public Date getUpdateTime() {
		return updateTime;
	}

	public void setUpdateTime(Date updateTime) {
		this.updateTime = updateTime;
	}

	/**
	 * @param cutoffMs see RegistryConfig.aliveCutoff
	 */
	public boolean isAlive(long cutoffMs) {
		return updateTime != null && updateTime.getTime() >= cutoffMs;
	}

	@Override
	public String toString() {
		return "JobRegistry{" +
				"registryGroup='" + registryGroup + '\'' +
				", registryKey='" + registryKey + '\'' +
				", registryValue='" + registryValue + '\'' +
				", updateTime=" + updateTime +
				'}';
	}

}

package com.sunny.jobconsole.admin.mapper;

import com.sunny.jobconsole.admin.model.JobRegistry;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Date;
import java.util.List;

/**
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Mapper
public interface JobRegistryMapper {

    /**
     * every entry of a (group, key), alive or not
     */
    public List<JobRegistry> findByKey(@Param("registryGroup") String registryGroup,
                                       @Param("registryKey") String registryKey);

    public int registrySaveOrUpdate(@Param("registryGroup") String registryGroup,
                            @Param("registryKey") String registryKey,
                            @Param("registryValue") String registryValue,
                            @Param("updateTime") Date updateTime);

    public int registryDelete(@Param("registryGroup") String registryGroup,
                          @Param("registryKey") String registryKey,
                          @Param("registryValue") String registryValue);

}

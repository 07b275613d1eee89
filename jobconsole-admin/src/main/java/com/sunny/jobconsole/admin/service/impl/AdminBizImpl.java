package com.sunny.jobconsole.admin.service.impl;

import com.sunny.jobconsole.admin.scheduler.complete.JobCompleter;
import com.sunny.jobconsole.admin.scheduler.thread.JobRegistryHelper;
import com.sunny.jobconsole.core.biz.AdminBiz;
import com.sunny.jobconsole.core.biz.model.HandleCallbackParam;
import com.sunny.jobconsole.core.biz.model.RegistryParam;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Service
public class AdminBizImpl implements AdminBiz {

    private final JobCompleter jobCompleter;
    private final JobRegistryHelper jobRegistryHelper;

    public AdminBizImpl(JobCompleter jobCompleter, JobRegistryHelper jobRegistryHelper) {
        this.jobCompleter = jobCompleter;
        this.jobRegistryHelper = jobRegistryHelper;
    }

    @Override
    public ReturnT<String> callback(List<HandleCallbackParam> callbackParamList) {
        return jobCompleter.callback(callbackParamList);
    }

    @Override
    public ReturnT<String> registry(RegistryParam registryParam) {
        return jobRegistryHelper.registry(registryParam);
    }

    @Override
    public ReturnT<String> registryRemove(RegistryParam registryParam) {
        return jobRegistryHelper.registryRemove(registryParam);
    }

}

package com.sunny.jobconsole.core.biz;

import com.sunny.jobconsole.core.biz.model.HandleCallbackParam;
import com.sunny.jobconsole.core.biz.model.RegistryParam;
import com.sunny.jobconsole.core.biz.model.ReturnT;

import java.util.List;

/**
 * Calls an executor makes on the console.
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
public interface AdminBiz {


    // ---------------------- callback ----------------------

    /**
     * callback
     *
     * @param callbackParamList
     * @return always success, per-item failures are only logged
     */
    public ReturnT<String> callback(List<HandleCallbackParam> callbackParamList);


    // ---------------------- registry ----------------------

    /**
     * registry
     *
     * @param registryParam
     * @return
     */
    public ReturnT<String> registry(RegistryParam registryParam) ;

    /**
     * registry remove
     *
     * @param registryParam
     * @return
     */
    public ReturnT<String> registryRemove(RegistryParam registryParam) ;

}

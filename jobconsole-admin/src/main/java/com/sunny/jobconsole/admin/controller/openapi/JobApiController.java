package com.sunny.jobconsole.admin.controller.openapi;

import com.google.gson.JsonParseException;
import com.sunny.jobconsole.admin.conf.JobConsoleAdminConfig;
import com.sunny.jobconsole.core.biz.AdminBiz;
import com.sunny.jobconsole.core.biz.model.HandleCallbackParam;
import com.sunny.jobconsole.core.biz.model.RegistryParam;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.util.GsonTool;
import com.sunny.jobconsole.core.util.JobRemotingUtil;
import com.sunny.jobconsole.core.util.StringTool;
import jakarta.annotation.Resource;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.List;

/**
 * executor facing api: callback, registry, registryRemove
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Controller
@RequestMapping("/api")
public class JobApiController {
    private static final Logger logger = LoggerFactory.getLogger(JobApiController.class);

    @Resource
    private AdminBiz adminBiz;
    @Resource
    private JobConsoleAdminConfig adminConfig;

    /**
     * api
     *
     * @param uri
     * @param data
     * @return
     */
    @RequestMapping("/{uri}")
    @ResponseBody
    public ReturnT<String> api(HttpServletRequest request, @PathVariable("uri") String uri, @RequestBody(required = false) String data) {

        // valid
        if (!"POST".equalsIgnoreCase(request.getMethod())) {
            return ReturnT.ofFail("invalid request, HttpMethod not support.");
        }
        if (StringTool.isBlank(uri)) {
            return ReturnT.ofFail("invalid request, uri-mapping empty.");
        }
        String accessToken = adminConfig.getAccessToken();
        if (accessToken != null
                && !accessToken.equals(request.getHeader(JobRemotingUtil.XXL_JOB_ACCESS_TOKEN))) {
            return ReturnT.ofFail("The access token is wrong.");
        }

        // services mapping
        try {
            if ("callback".equals(uri)) {
                List<HandleCallbackParam> callbackParamList = GsonTool.fromJsonList(data, HandleCallbackParam.class);
                return adminBiz.callback(callbackParamList);
            } else if ("registry".equals(uri)) {
                RegistryParam registryParam = GsonTool.fromJson(data, RegistryParam.class);
                return adminBiz.registry(registryParam);
            } else if ("registryRemove".equals(uri)) {
                RegistryParam registryParam = GsonTool.fromJson(data, RegistryParam.class);
                return adminBiz.registryRemove(registryParam);
            } else {
                return ReturnT.ofFail("invalid request, uri-mapping("+ uri +") not found.");
            }
        } catch (JsonParseException e) {
            logger.warn(">>>>>>>>>>> jobconsole api request body invalid, uri:{}, msg:{}", uri, e.getMessage());
            return ReturnT.ofFail("invalid request, body is not valid json.");
        }

    }

}

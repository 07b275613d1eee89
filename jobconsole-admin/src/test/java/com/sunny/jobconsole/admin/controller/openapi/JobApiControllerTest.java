package com.sunny.jobconsole.admin.controller.openapi;

import com.sunny.jobconsole.admin.conf.JobConsoleAdminConfig;
import com.sunny.jobconsole.core.biz.AdminBiz;
import com.sunny.jobconsole.core.biz.model.HandleCallbackParam;
import com.sunny.jobconsole.core.biz.model.RegistryParam;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.util.JobRemotingUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class JobApiControllerTest {

    private static final String TOKEN = "test_token";

    @Mock
    private AdminBiz adminBiz;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        JobApiController controller = new JobApiController();
        ReflectionTestUtils.setField(controller, "adminBiz", adminBiz);
        ReflectionTestUtils.setField(controller, "adminConfig", new JobConsoleAdminConfig(TOKEN, 3, 90, "UTC"));
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void callback_shouldAcceptLegacyDateFieldName() throws Exception {
        when(adminBiz.callback(any())).thenReturn(ReturnT.ofSuccess());

        mockMvc.perform(post("/api/callback")
                        .header(JobRemotingUtil.XXL_JOB_ACCESS_TOKEN, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"logId\":42,\"logDateTim\":1767261600000,\"handleCode\":200,\"handleMsg\":\"ok\"}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<HandleCallbackParam>> captor = ArgumentCaptor.forClass(List.class);
        verify(adminBiz).callback(captor.capture());
        HandleCallbackParam param = captor.getValue().get(0);
        assertEquals(42L, param.getLogId());
        assertEquals(1767261600000L, param.getLogDateTime());
        assertEquals(200, param.getHandleCode());
        assertEquals("ok", param.getHandleMsg());
    }

    @Test
    void registry_shouldDispatchToAdminBiz() throws Exception {
        when(adminBiz.registry(any())).thenReturn(ReturnT.ofSuccess());

        mockMvc.perform(post("/api/registry")
                        .header(JobRemotingUtil.XXL_JOB_ACCESS_TOKEN, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"registryGroup\":\"EXECUTOR\",\"registryKey\":\"demo-executor\",\"registryValue\":\"http://10.0.0.1:9999\"}"))
                .andExpect(jsonPath("$.code").value(200));

        ArgumentCaptor<RegistryParam> captor = ArgumentCaptor.forClass(RegistryParam.class);
        verify(adminBiz).registry(captor.capture());
        assertEquals("demo-executor", captor.getValue().getRegistryKey());
        assertEquals("http://10.0.0.1:9999", captor.getValue().getRegistryValue());
    }

    @Test
    void registryRemove_shouldDispatchToAdminBiz() throws Exception {
        when(adminBiz.registryRemove(any())).thenReturn(ReturnT.ofSuccess());

        mockMvc.perform(post("/api/registryRemove")
                        .header(JobRemotingUtil.XXL_JOB_ACCESS_TOKEN, TOKEN)
                        .content("{\"registryGroup\":\"EXECUTOR\",\"registryKey\":\"demo-executor\",\"registryValue\":\"10.0.0.1:9999\"}"))
                .andExpect(jsonPath("$.code").value(200));

        verify(adminBiz).registryRemove(any());
    }

    @Test
    void api_shouldRejectWrongToken() throws Exception {
        mockMvc.perform(post("/api/callback")
                        .header(JobRemotingUtil.XXL_JOB_ACCESS_TOKEN, "other")
                        .content("[]"))
                .andExpect(jsonPath("$.code").value(500))
                .andExpect(jsonPath("$.msg").value("The access token is wrong."));

        verifyNoInteractions(adminBiz);
    }

    @Test
    void api_shouldRejectMissingToken() throws Exception {
        mockMvc.perform(post("/api/callback").content("[]"))
                .andExpect(jsonPath("$.msg").value("The access token is wrong."));

        verifyNoInteractions(adminBiz);
    }

    @Test
    void api_shouldRejectNonPost() throws Exception {
        mockMvc.perform(get("/api/callback").header(JobRemotingUtil.XXL_JOB_ACCESS_TOKEN, TOKEN))
                .andExpect(jsonPath("$.code").value(500))
                .andExpect(jsonPath("$.msg").value("invalid request, HttpMethod not support."));
    }

    @Test
    void api_shouldRejectUnknownUri() throws Exception {
        mockMvc.perform(post("/api/beat")
                        .header(JobRemotingUtil.XXL_JOB_ACCESS_TOKEN, TOKEN)
                        .content("{}"))
                .andExpect(jsonPath("$.msg").value("invalid request, uri-mapping(beat) not found."));
    }

    @Test
    void api_shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/callback")
                        .header(JobRemotingUtil.XXL_JOB_ACCESS_TOKEN, TOKEN)
                        .content("[{\"logId\":"))
                .andExpect(jsonPath("$.code").value(500))
                .andExpect(jsonPath("$.msg").value("invalid request, body is not valid json."));

        verifyNoInteractions(adminBiz);
    }

    @Test
    void api_shouldSkipTokenCheckWhenNotConfigured() throws Exception {
        JobApiController controller = new JobApiController();
        ReflectionTestUtils.setField(controller, "adminBiz", adminBiz);
        ReflectionTestUtils.setField(controller, "adminConfig", new JobConsoleAdminConfig(" ", 3, 90, "UTC"));
        MockMvc openMvc = MockMvcBuilders.standaloneSetup(controller).build();
        when(adminBiz.callback(any())).thenReturn(ReturnT.ofSuccess());

        openMvc.perform(post("/api/callback").content("[]"))
                .andExpect(jsonPath("$.code").value(200));
    }
}

package com.sunny.jobconsole.admin.scheduler.thread;

import com.sunny.jobconsole.admin.mapper.JobRegistryMapper;
import com.sunny.jobconsole.core.biz.model.RegistryParam;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class JobRegistryHelperTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock
    private JobRegistryMapper jobRegistryMapper;

    private JobRegistryHelper helper;

    @BeforeEach
    void setUp() {
        helper = new JobRegistryHelper(jobRegistryMapper, Clock.fixed(NOW, ZoneOffset.UTC));
        helper.start();
    }

    @AfterEach
    void tearDown() {
        helper.toStop();
    }

    @Test
    void registry_shouldUpsertTrimmedValues() {
        ReturnT<String> result = helper.registry(new RegistryParam(" EXECUTOR ", "demo-executor ", " 10.0.0.1:9999"));

        assertTrue(result.isSuccess());
        verify(jobRegistryMapper, timeout(2000))
                .registrySaveOrUpdate("EXECUTOR", "demo-executor", "10.0.0.1:9999", Date.from(NOW));
    }

    @Test
    void registryRemove_shouldDeleteEntry() {
        ReturnT<String> result = helper.registryRemove(new RegistryParam("EXECUTOR", "demo-executor", "10.0.0.1:9999"));

        assertTrue(result.isSuccess());
        verify(jobRegistryMapper, timeout(2000)).registryDelete("EXECUTOR", "demo-executor", "10.0.0.1:9999");
    }

    @Test
    void registry_shouldRejectBlankFields() {
        ReturnT<String> result = helper.registry(new RegistryParam("EXECUTOR", " ", "10.0.0.1:9999"));

        assertEquals(ReturnT.FAIL_CODE, result.getCode());
        assertEquals("Illegal Argument.", result.getMsg());
        assertEquals(ReturnT.FAIL_CODE, helper.registryRemove(null).getCode());

        helper.toStop();
        verify(jobRegistryMapper, never()).registrySaveOrUpdate(anyString(), anyString(), anyString(), any());
        verify(jobRegistryMapper, never()).registryDelete(anyString(), anyString(), anyString());
    }
}

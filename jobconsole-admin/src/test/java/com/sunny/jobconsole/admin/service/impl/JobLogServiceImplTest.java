package com.sunny.jobconsole.admin.service.impl;

import com.sunny.jobconsole.admin.mapper.JobLogMapper;
import com.sunny.jobconsole.admin.model.JobLog;
import com.sunny.jobconsole.admin.scheduler.ExecutorBizRepository;
import com.sunny.jobconsole.admin.scheduler.complete.JobCompleter;
import com.sunny.jobconsole.core.biz.ExecutorBiz;
import com.sunny.jobconsole.core.biz.model.LogParam;
import com.sunny.jobconsole.core.biz.model.LogResult;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.exception.ExecutorInvokeException;
import com.sunny.jobconsole.core.exception.ExecutorInvokeException.FailureType;
import com.sunny.jobconsole.core.exception.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobLogServiceImplTest {

    private static final Instant TRIGGER_TIME = Instant.parse("2026-01-01T10:00:00Z");
    private static final String ADDRESS = "http://10.0.0.1:9999";

    @Mock
    private JobLogMapper jobLogMapper;
    @Mock
    private ExecutorBizRepository executorBizRepository;
    @Mock
    private JobCompleter jobCompleter;
    @Mock
    private ExecutorBiz executorBiz;

    private JobLogServiceImpl jobLogService;

    @BeforeEach
    void setUp() {
        jobLogService = new JobLogServiceImpl(jobLogMapper, executorBizRepository, jobCompleter);
    }

    private static JobLog dispatchedLog() {
        JobLog log = new JobLog();
        log.setId(42L);
        log.setExecutorAddress(ADDRESS);
        log.setTriggerTime(Date.from(TRIGGER_TIME));
        log.setTriggerCode(200);
        log.setTriggerMsg("Trigger type: Cron");
        log.setHandleCode(0);
        return log;
    }

    @Test
    void logDetailCat_shouldReturnExecutorLog() {
        when(jobLogMapper.load(42L)).thenReturn(dispatchedLog());
        when(executorBizRepository.getExecutorBiz(ADDRESS)).thenReturn(executorBiz);
        LogResult executorLog = new LogResult(3, 5, "c\nd\ne", false);
        when(executorBiz.log(any())).thenReturn(ReturnT.ofSuccess(executorLog));

        ReturnT<LogResult> result = jobLogService.logDetailCat(42L, 3);

        assertSame(executorLog, result.getContent());
        ArgumentCaptor<LogParam> captor = ArgumentCaptor.forClass(LogParam.class);
        verify(executorBiz).log(captor.capture());
        assertEquals(42L, captor.getValue().getLogId());
        assertEquals(TRIGGER_TIME.toEpochMilli(), captor.getValue().getLogDateTim());
        assertEquals(3, captor.getValue().getFromLineNum());
    }

    @Test
    void logDetailCat_shouldClampFromLineNum() {
        when(jobLogMapper.load(42L)).thenReturn(dispatchedLog());
        when(executorBizRepository.getExecutorBiz(ADDRESS)).thenReturn(executorBiz);
        when(executorBiz.log(any())).thenReturn(ReturnT.ofSuccess(new LogResult(1, 1, "a", true)));

        jobLogService.logDetailCat(42L, -5);

        ArgumentCaptor<LogParam> captor = ArgumentCaptor.forClass(LogParam.class);
        verify(executorBiz).log(captor.capture());
        assertEquals(1, captor.getValue().getFromLineNum());
    }

    @Test
    void logDetailCat_shouldSummarizeFailedDispatch() {
        JobLog log = dispatchedLog();
        log.setTriggerCode(500);
        log.setExecutorAddress(null);
        log.setTriggerMsg("All candidate executors failed");
        when(jobLogMapper.load(42L)).thenReturn(log);

        LogResult result = jobLogService.logDetailCat(42L, 1).getContent();

        assertTrue(result.getLogContent().contains("All candidate executors failed"));
        assertTrue(result.getLogContent().endsWith("Note: dispatch failed, executor log unavailable"));
        assertTrue(result.isEnd());
        assertEquals(result.getLogContent().split("\n").length, result.getToLineNum());
        verifyNoInteractions(executorBizRepository);
    }

    @Test
    void logDetailCat_shouldSummarizeMissingAddress() {
        JobLog log = dispatchedLog();
        log.setExecutorAddress(" ");
        log.setHandleCode(500);
        log.setHandleMsg("Killed by operator sunny");
        when(jobLogMapper.load(42L)).thenReturn(log);

        LogResult result = jobLogService.logDetailCat(42L, 1).getContent();

        assertEquals("Trigger log:\nTrigger type: Cron\nHandle log:\nKilled by operator sunny\n\nNote: executor address unknown",
                result.getLogContent());
        verifyNoInteractions(executorBizRepository);
    }

    @Test
    void logDetailCat_shouldSummarizeUnreachableExecutor() {
        when(jobLogMapper.load(42L)).thenReturn(dispatchedLog());
        when(executorBizRepository.getExecutorBiz(ADDRESS)).thenReturn(executorBiz);
        when(executorBiz.log(any())).thenThrow(new ExecutorInvokeException(FailureType.CONNECT_ERROR, "connection refused"));

        ReturnT<LogResult> result = jobLogService.logDetailCat(42L, 1);

        assertTrue(result.isSuccess());
        assertTrue(result.getContent().getLogContent().endsWith("Note: connection refused"));
    }

    @Test
    void logDetailCat_shouldSummarizeExecutorFailure() {
        when(jobLogMapper.load(42L)).thenReturn(dispatchedLog());
        when(executorBizRepository.getExecutorBiz(ADDRESS)).thenReturn(executorBiz);
        when(executorBiz.log(any())).thenReturn(ReturnT.ofFail("log file not found"));

        LogResult result = jobLogService.logDetailCat(42L, 1).getContent();

        assertTrue(result.getLogContent().endsWith("Note: log file not found"));
    }

    @Test
    void logDetailCat_shouldSummarizeEmptyExecutorAnswer() {
        when(jobLogMapper.load(42L)).thenReturn(dispatchedLog());
        when(executorBizRepository.getExecutorBiz(ADDRESS)).thenReturn(executorBiz);
        when(executorBiz.log(any())).thenReturn(ReturnT.ofSuccess());

        LogResult result = jobLogService.logDetailCat(42L, 1).getContent();

        assertTrue(result.getLogContent().endsWith("Note: executor returned no log content"));
    }

    @Test
    void logDetailCat_shouldRejectMissingLog() {
        when(jobLogMapper.load(7L)).thenReturn(null);

        assertThrows(NotFoundException.class, () -> jobLogService.logDetailCat(7L, 1));
    }

    @Test
    void kill_shouldDelegateToCompleter() {
        ReturnT<String> result = jobLogService.kill(42L, "sunny");

        assertTrue(result.isSuccess());
        verify(jobCompleter).kill(42L, "sunny");
    }
}

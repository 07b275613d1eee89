package com.sunny.jobconsole.admin.scheduler.route;

import com.sunny.jobconsole.admin.conf.JobConsoleAdminConfig;
import com.sunny.jobconsole.admin.mapper.JobRegistryMapper;
import com.sunny.jobconsole.admin.model.JobGroup;
import com.sunny.jobconsole.admin.model.JobRegistry;
import com.sunny.jobconsole.admin.scheduler.exception.NoAvailableExecutorException;
import com.sunny.jobconsole.core.enums.AddressTypeEnum;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutorAddressResolverTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock
    private JobRegistryMapper jobRegistryMapper;

    private ExecutorAddressResolver resolver;

    @BeforeEach
    void setUp() {
        JobConsoleAdminConfig adminConfig = new JobConsoleAdminConfig(null, 3, 90, "UTC");
        resolver = new ExecutorAddressResolver(jobRegistryMapper, adminConfig, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static JobGroup group(int addressType, String addressList) {
        JobGroup group = new JobGroup();
        group.setId(1);
        group.setAppname("demo-executor");
        group.setTitle("demo");
        group.setAddressType(addressType);
        group.setAddressList(addressList);
        return group;
    }

    private static JobRegistry registry(String value, long secondsAgo) {
        JobRegistry registry = new JobRegistry();
        registry.setRegistryGroup("EXECUTOR");
        registry.setRegistryKey("demo-executor");
        registry.setRegistryValue(value);
        registry.setUpdateTime(Date.from(NOW.minusSeconds(secondsAgo)));
        return registry;
    }

    @Test
    void resolve_shouldPreferOverride() {
        List<String> list = resolver.resolve(group(AddressTypeEnum.MANUAL.getCode(), "10.0.0.9:9999"),
                " 10.0.0.1:9999,\n10.0.0.2:9999 ,10.0.0.1:9999");

        assertEquals(List.of("http://10.0.0.1:9999", "http://10.0.0.2:9999"), list);
        verify(jobRegistryMapper, never()).findByKey(anyString(), anyString());
    }

    @Test
    void resolve_shouldUseStaticListWhenOverrideUnusable() {
        List<String> list = resolver.resolve(group(AddressTypeEnum.MANUAL.getCode(), "https://a:1,b:2"), " , ");

        assertEquals(List.of("https://a:1", "http://b:2"), list);
        verify(jobRegistryMapper, never()).findByKey(anyString(), anyString());
    }

    @Test
    void resolve_shouldIgnoreStaticListOfAutoGroup() {
        when(jobRegistryMapper.findByKey("EXECUTOR", "demo-executor")).thenReturn(List.of(registry("10.0.0.5:9999", 10)));

        List<String> list = resolver.resolve(group(AddressTypeEnum.AUTO.getCode(), "10.0.0.9:9999"), null);

        assertEquals(List.of("http://10.0.0.5:9999"), list);
    }

    @Test
    void resolve_shouldReturnOnlyAliveRegistryEntries() {
        when(jobRegistryMapper.findByKey("EXECUTOR", "demo-executor")).thenReturn(List.of(
                registry("10.0.0.1:9999", 300),
                registry("10.0.0.2:9999", 10),
                registry("http://10.0.0.2:9999", 5),
                registry("10.0.0.3:9999", 90)));

        List<String> list = resolver.resolve(group(AddressTypeEnum.AUTO.getCode(), null), null);

        assertEquals(List.of("http://10.0.0.2:9999", "http://10.0.0.3:9999"), list);
    }

    @Test
    void resolve_shouldFallBackToStaleEntries() {
        when(jobRegistryMapper.findByKey("EXECUTOR", "demo-executor")).thenReturn(List.of(
                registry("10.0.0.1:9999", 300),
                registry("10.0.0.2:9999", 91)));

        List<String> list = resolver.resolve(group(AddressTypeEnum.AUTO.getCode(), null), null);

        assertEquals(List.of("http://10.0.0.1:9999", "http://10.0.0.2:9999"), list);
    }

    @Test
    void resolve_shouldFallThroughEmptyStaticListToRegistry() {
        when(jobRegistryMapper.findByKey("EXECUTOR", "demo-executor")).thenReturn(List.of(registry("10.0.0.4:9999", 1)));

        List<String> list = resolver.resolve(group(AddressTypeEnum.MANUAL.getCode(), " "), null);

        assertEquals(List.of("http://10.0.0.4:9999"), list);
    }

    @Test
    void resolve_shouldFailWhenNothingAvailable() {
        when(jobRegistryMapper.findByKey("EXECUTOR", "demo-executor")).thenReturn(List.of());

        assertThrows(NoAvailableExecutorException.class,
                () -> resolver.resolve(group(AddressTypeEnum.AUTO.getCode(), null), ""));
    }
}

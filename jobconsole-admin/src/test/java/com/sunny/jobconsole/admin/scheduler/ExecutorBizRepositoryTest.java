package com.sunny.jobconsole.admin.scheduler;

import com.sunny.jobconsole.admin.conf.JobConsoleAdminConfig;
import com.sunny.jobconsole.core.biz.ExecutorBiz;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutorBizRepositoryTest {

    private final JobConsoleAdminConfig adminConfig = new JobConsoleAdminConfig("token", 3, 90, "UTC");

    @Test
    void getExecutorBiz_shouldReuseClientPerAddress() {
        ExecutorBizRepository repository = new ExecutorBizRepository(adminConfig);

        ExecutorBiz first = repository.getExecutorBiz("http://10.0.0.1:9999/");
        ExecutorBiz second = repository.getExecutorBiz("  http://10.0.0.1:9999/ ");
        ExecutorBiz other = repository.getExecutorBiz("http://10.0.0.2:9999/");

        assertSame(first, second);
        assertNotSame(first, other);
    }

    @Test
    void getExecutorBiz_shouldBoundCacheForManyDistinctAddresses() {
        ExecutorBizRepository repository = new ExecutorBizRepository(adminConfig, 100, Duration.ofMinutes(30));

        for (int i = 0; i < 5000; i++) {
            repository.getExecutorBiz("http://10.0." + (i / 250) + "." + (i % 250) + ":9999/");
        }

        assertTrue(repository.cacheSize() <= 100, "cache size " + repository.cacheSize());
    }

    @Test
    void getExecutorBiz_shouldBoundDefaultCache() {
        ExecutorBizRepository repository = new ExecutorBizRepository(adminConfig);

        for (int i = 0; i < 5000; i++) {
            repository.getExecutorBiz("http://executor-" + i + ":9999/");
        }

        assertTrue(repository.cacheSize() <= ExecutorBizRepository.MAX_SIZE);
    }
}

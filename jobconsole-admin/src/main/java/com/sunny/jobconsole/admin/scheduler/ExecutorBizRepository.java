package com.sunny.jobconsole.admin.scheduler;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sunny.jobconsole.admin.conf.JobConsoleAdminConfig;
import com.sunny.jobconsole.core.biz.ExecutorBiz;
import com.sunny.jobconsole.core.biz.client.ExecutorBizClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * executor client cache, one client per address
 * <p>
 * 地址来自注册表和手工配置，数量不受控，使用 Caffeine 限制容量并在闲置后淘汰
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Component
public class ExecutorBizRepository {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorBizRepository.class);

    static final long MAX_SIZE = 1000;
    static final Duration EXPIRE_AFTER_ACCESS = Duration.ofMinutes(30);

    private final JobConsoleAdminConfig adminConfig;
    private final Cache<String, ExecutorBiz> executorBizCache;

    @Autowired
    public ExecutorBizRepository(JobConsoleAdminConfig adminConfig) {
        this(adminConfig, MAX_SIZE, EXPIRE_AFTER_ACCESS);
    }

    ExecutorBizRepository(JobConsoleAdminConfig adminConfig, long maxSize, Duration expireAfterAccess) {
        this.adminConfig = adminConfig;
        this.executorBizCache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterAccess(expireAfterAccess)
                .build();

        logger.info(">>>>>>>>>>> jobconsole executor client cache init, maxSize:{}, expireAfterAccess:{}",
                maxSize, expireAfterAccess);
    }

    public ExecutorBiz getExecutorBiz(String address) {
        String key = address.trim();
        return executorBizCache.get(key,
                item -> new ExecutorBizClient(item, adminConfig.getAccessToken(), adminConfig.getTimeout()));
    }

    /**
     * entries currently held, after pending evictions are applied
     */
    long cacheSize() {
        executorBizCache.cleanUp();
        return executorBizCache.estimatedSize();
    }

}

package com.sunny.jobconsole.admin.scheduler.route;

import com.sunny.jobconsole.admin.conf.JobConsoleAdminConfig;
import com.sunny.jobconsole.admin.mapper.JobRegistryMapper;
import com.sunny.jobconsole.admin.model.JobGroup;
import com.sunny.jobconsole.admin.model.JobRegistry;
import com.sunny.jobconsole.admin.scheduler.exception.NoAvailableExecutorException;
import com.sunny.jobconsole.core.enums.AddressTypeEnum;
import com.sunny.jobconsole.core.enums.RegistryConfig;
import com.sunny.jobconsole.core.util.StringTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 执行器候选地址解析
 * <p>
 * 优先级：手动指定地址 &gt; 分组静态地址(手动录入) &gt; 注册中心存活实例 &gt; 注册中心超时实例
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Component
public class ExecutorAddressResolver {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorAddressResolver.class);

    private final JobRegistryMapper jobRegistryMapper;
    private final JobConsoleAdminConfig adminConfig;
    private final Clock clock;

    public ExecutorAddressResolver(JobRegistryMapper jobRegistryMapper, JobConsoleAdminConfig adminConfig, Clock clock) {
        this.jobRegistryMapper = jobRegistryMapper;
        this.adminConfig = adminConfig;
        this.clock = clock;
    }

    /**
     * @param group           executor group of the job
     * @param addressOverride caller supplied list, "," or newline separated, may be null
     * @return ordered, deduplicated, non-empty candidate list
     * @throws NoAvailableExecutorException when no source yields an address
     */
    public List<String> resolve(JobGroup group, String addressOverride) {

        // 1、override
        if (addressOverride != null) {
            List<String> list = StringTool.parseAddressList(addressOverride);
            if (!list.isEmpty()) {
                logger.info(">>>>>>>>>>> jobconsole, use override address, group:{}, count:{}", group.getId(), list.size());
                return list;
            }
            logger.warn(">>>>>>>>>>> jobconsole, override address empty or invalid, group:{}", group.getId());
        }

        // 2、static list
        if (group.getAddressType() == AddressTypeEnum.MANUAL.getCode()) {
            List<String> list = group.getRegistryList();
            if (!list.isEmpty()) {
                logger.info(">>>>>>>>>>> jobconsole, use group static address, group:{}, count:{}", group.getId(), list.size());
                return list;
            }
            logger.warn(">>>>>>>>>>> jobconsole, group static address empty, fall back to registry, group:{}", group.getId());
        }

        // 3、registry
        long cutoff = RegistryConfig.aliveCutoff(clock.millis(), adminConfig.getRegistryDeadTimeout());
        List<JobRegistry> registryList = jobRegistryMapper.findByKey(RegistryConfig.RegistType.EXECUTOR.name(), group.getAppname());

        Set<String> unique = new HashSet<>();
        List<String> alive = new ArrayList<>();
        List<String> stale = new ArrayList<>();
        Date lastSeen = null;
        if (registryList != null) {
            for (JobRegistry item : registryList) {
                String address = StringTool.normalizeAddress(item.getRegistryValue());
                if (address == null || !unique.add(address)) {
                    continue;
                }
                if (item.isAlive(cutoff)) {
                    alive.add(address);
                } else {
                    stale.add(address);
                    Date updateTime = item.getUpdateTime();
                    if (updateTime != null && (lastSeen == null || updateTime.after(lastSeen))) {
                        lastSeen = updateTime;
                    }
                }
            }
        }

        if (!stale.isEmpty()) {
            logger.warn(">>>>>>>>>>> jobconsole, skip registry instances past dead timeout, group:{}, skipped:{}, cutoff:{}, lastSeen:{}",
                    group.getId(), stale.size(), new Date(cutoff), lastSeen);
        }
        if (!alive.isEmpty()) {
            logger.info(">>>>>>>>>>> jobconsole, use registry address, group:{}, count:{}, staleSkipped:{}",
                    group.getId(), alive.size(), stale.size());
            return alive;
        }
        if (!stale.isEmpty()) {
            logger.warn(">>>>>>>>>>> jobconsole, all registry instances timed out, fall back to last reported address, group:{}, count:{}",
                    group.getId(), stale.size());
            return stale;
        }

        logger.error(">>>>>>>>>>> jobconsole, no executor available, group:{}, appname:{}", group.getId(), group.getAppname());
        throw new NoAvailableExecutorException("no executor available for group %s, check that the executor is registered and beating",
                group.getAppname());
    }

}

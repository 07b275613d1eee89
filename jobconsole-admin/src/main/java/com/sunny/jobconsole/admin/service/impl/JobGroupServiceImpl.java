package com.sunny.jobconsole.admin.service.impl;

import com.sunny.jobconsole.admin.conf.JobConsoleAdminConfig;
import com.sunny.jobconsole.admin.mapper.JobGroupMapper;
import com.sunny.jobconsole.admin.mapper.JobInfoMapper;
import com.sunny.jobconsole.admin.mapper.JobRegistryMapper;
import com.sunny.jobconsole.admin.model.JobGroup;
import com.sunny.jobconsole.admin.model.JobRegistry;
import com.sunny.jobconsole.admin.service.JobGroupService;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.enums.AddressTypeEnum;
import com.sunny.jobconsole.core.enums.RegistryConfig;
import com.sunny.jobconsole.core.exception.BadRequestException;
import com.sunny.jobconsole.core.exception.NotFoundException;
import com.sunny.jobconsole.core.util.StringTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.TreeSet;

/**
 * 执行器分组管理
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Service
public class JobGroupServiceImpl implements JobGroupService {
    private static final Logger logger = LoggerFactory.getLogger(JobGroupServiceImpl.class);

    private final JobGroupMapper jobGroupMapper;
    private final JobInfoMapper jobInfoMapper;
    private final JobRegistryMapper jobRegistryMapper;
    private final JobConsoleAdminConfig adminConfig;
    private final Clock clock;

    public JobGroupServiceImpl(JobGroupMapper jobGroupMapper,
                               JobInfoMapper jobInfoMapper,
                               JobRegistryMapper jobRegistryMapper,
                               JobConsoleAdminConfig adminConfig,
                               Clock clock) {
        this.jobGroupMapper = jobGroupMapper;
        this.jobInfoMapper = jobInfoMapper;
        this.jobRegistryMapper = jobRegistryMapper;
        this.adminConfig = adminConfig;
        this.clock = clock;
    }

    @Override
    public ReturnT<List<JobGroup>> list() {
        return ReturnT.ofSuccess(jobGroupMapper.findAll());
    }

    @Override
    public ReturnT<JobGroup> load(int id) {
        return ReturnT.ofSuccess(loadGroup(id));
    }

    @Override
    public ReturnT<String> save(JobGroup jobGroup) {
        prepare(jobGroup);
        jobGroupMapper.save(jobGroup);
        logger.info(">>>>>>>>>>> jobconsole group saved, id:{}, appname:{}", jobGroup.getId(), jobGroup.getAppname());
        return ReturnT.ofSuccess(String.valueOf(jobGroup.getId()));
    }

    @Override
    public ReturnT<String> update(JobGroup jobGroup) {
        loadGroup(jobGroup.getId());
        prepare(jobGroup);
        jobGroupMapper.update(jobGroup);
        logger.info(">>>>>>>>>>> jobconsole group updated, id:{}, appname:{}", jobGroup.getId(), jobGroup.getAppname());
        return ReturnT.ofSuccess();
    }

    @Override
    public ReturnT<String> remove(int id) {
        loadGroup(id);

        int count = jobInfoMapper.countByGroup(id);
        if (count > 0) {
            throw new BadRequestException("group is still used by %s job(s), refuse to delete", count);
        }
        List<JobGroup> allList = jobGroupMapper.findAll();
        if (allList.size() == 1) {
            throw new BadRequestException("refuse to delete the last executor group");
        }

        jobGroupMapper.remove(id);
        logger.info(">>>>>>>>>>> jobconsole group removed, id:{}", id);
        return ReturnT.ofSuccess();
    }

    private JobGroup loadGroup(int id) {
        JobGroup group = jobGroupMapper.load(id);
        if (group == null) {
            throw new NotFoundException("executor group not found, id=%s", id);
        }
        return group;
    }

    /**
     * valid, then fill address list and update time
     */
    private void prepare(JobGroup jobGroup) {
        if (jobGroup == null) {
            throw new BadRequestException("executor group is empty");
        }
        if (StringTool.isBlank(jobGroup.getAppname())) {
            throw new BadRequestException("appname is empty");
        }
        if (StringTool.isBlank(jobGroup.getTitle())) {
            throw new BadRequestException("title is empty");
        }
        jobGroup.setAppname(jobGroup.getAppname().trim());
        jobGroup.setTitle(jobGroup.getTitle().trim());

        AddressTypeEnum addressType = AddressTypeEnum.of(jobGroup.getAddressType());
        if (addressType == null) {
            throw new BadRequestException("invalid address type: %s", jobGroup.getAddressType());
        }
        if (addressType == AddressTypeEnum.MANUAL) {
            jobGroup.setAddressList(validManualAddressList(jobGroup.getAddressList()));
        } else {
            jobGroup.setAddressList(registrySnapshot(jobGroup.getAppname()));
        }
        jobGroup.setUpdateTime(new Date(clock.millis()));
    }

    private static String validManualAddressList(String addressList) {
        if (StringTool.isBlank(addressList)) {
            throw new BadRequestException("address list is empty for manual address type");
        }
        List<String> items = new ArrayList<>();
        for (String item : addressList.split("[,\\n]", -1)) {
            String address = item.trim();
            if (address.isEmpty()) {
                throw new BadRequestException("address list contains an empty entry");
            }
            if (address.contains("<") || address.contains(">")) {
                throw new BadRequestException("address list contains illegal characters: %s", address);
            }
            items.add(address);
        }
        return String.join(",", items);
    }

    /**
     * display only, dispatch reads the registry itself
     */
    private String registrySnapshot(String appname) {
        long cutoff = RegistryConfig.aliveCutoff(clock.millis(), adminConfig.getRegistryDeadTimeout());
        TreeSet<String> addresses = new TreeSet<>();
        List<JobRegistry> registryList = jobRegistryMapper.findByKey(RegistryConfig.RegistType.EXECUTOR.name(), appname);
        if (registryList != null) {
            for (JobRegistry item : registryList) {
                if (item.isAlive(cutoff) && StringTool.isNotBlank(item.getRegistryValue())) {
                    addresses.add(item.getRegistryValue().trim());
                }
            }
        }
        return addresses.isEmpty() ? null : String.join(",", addresses);
    }

}

package com.sunny.jobconsole.admin.scheduler.thread;

import com.sunny.jobconsole.admin.mapper.JobRegistryMapper;
import com.sunny.jobconsole.core.biz.model.RegistryParam;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.util.StringTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Date;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * job registry instance
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@Component
public class JobRegistryHelper implements InitializingBean, DisposableBean {
	private static final Logger logger = LoggerFactory.getLogger(JobRegistryHelper.class);

	private final JobRegistryMapper jobRegistryMapper;
	private final Clock clock;

	private ThreadPoolExecutor registryOrRemoveThreadPool = null;

	public JobRegistryHelper(JobRegistryMapper jobRegistryMapper, Clock clock) {
		this.jobRegistryMapper = jobRegistryMapper;
		this.clock = clock;
	}

	@Override
	public void afterPropertiesSet() {
		start();
	}

	@Override
	public void destroy() {
		toStop();
	}

	public void start(){

		// for registry or remove
		registryOrRemoveThreadPool = new ThreadPoolExecutor(
				2,
				10,
				30L,
				TimeUnit.SECONDS,
				new LinkedBlockingQueue<Runnable>(2000),
				new ThreadFactory() {
					@Override
					public Thread newThread(Runnable r) {
						return new Thread(r, "jobconsole, admin JobRegistryHelper-registryOrRemoveThreadPool-" + r.hashCode());
					}
				},
				new RejectedExecutionHandler() {
					@Override
					public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
						r.run();
						logger.warn(">>>>>>>>>>> jobconsole, registry or remove too fast, match threadpool rejected handler(run now).");
					}
				});
		logger.info(">>>>>>>>>>> jobconsole, registry helper started");
	}

	public void toStop(){
		if (registryOrRemoveThreadPool == null) {
			return;
		}
		registryOrRemoveThreadPool.shutdown();
		try {
			if (!registryOrRemoveThreadPool.awaitTermination(5, TimeUnit.SECONDS)) {
				registryOrRemoveThreadPool.shutdownNow();
			}
		} catch (InterruptedException e) {
			registryOrRemoveThreadPool.shutdownNow();
			Thread.currentThread().interrupt();
		}
		logger.info(">>>>>>>>>>> jobconsole, registry helper stopped");
	}


	// ---------------------- helper ----------------------

	public ReturnT<String> registry(RegistryParam registryParam) {

		// valid
		if (!valid(registryParam)) {
			return ReturnT.ofFail("Illegal Argument.");
		}
		String registryGroup = registryParam.getRegistryGroup().trim();
		String registryKey = registryParam.getRegistryKey().trim();
		String registryValue = registryParam.getRegistryValue().trim();

		// async execute
		registryOrRemoveThreadPool.execute(new Runnable() {
			@Override
			public void run() {
				try {
					int ret = jobRegistryMapper.registrySaveOrUpdate(registryGroup, registryKey, registryValue, new Date(clock.millis()));
					logger.debug(">>>>>>>>>>> jobconsole registry result, ret:{}, registryParam:{}", ret, registryParam);
				} catch (Exception e) {
					logger.error(">>>>>>>>>>> jobconsole registry error, registryParam:" + registryParam, e);
				}
			}
		});

		return ReturnT.ofSuccess();
	}

	public ReturnT<String> registryRemove(RegistryParam registryParam) {

		// valid
		if (!valid(registryParam)) {
			return ReturnT.ofFail("Illegal Argument.");
		}
		String registryGroup = registryParam.getRegistryGroup().trim();
		String registryKey = registryParam.getRegistryKey().trim();
		String registryValue = registryParam.getRegistryValue().trim();

		// async execute
		registryOrRemoveThreadPool.execute(new Runnable() {
			@Override
			public void run() {
				try {
					int ret = jobRegistryMapper.registryDelete(registryGroup, registryKey, registryValue);
					logger.info(">>>>>>>>>>> jobconsole registry remove, ret:{}, registryParam:{}", ret, registryParam);
				} catch (Exception e) {
					logger.error(">>>>>>>>>>> jobconsole registry remove error, registryParam:" + registryParam, e);
				}
			}
		});

		return ReturnT.ofSuccess();
	}

	private static boolean valid(RegistryParam registryParam) {
		return registryParam != null
				&& StringTool.isNotBlank(registryParam.getRegistryGroup())
				&& StringTool.isNotBlank(registryParam.getRegistryKey())
				&& StringTool.isNotBlank(registryParam.getRegistryValue());
	}

}

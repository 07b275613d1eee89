package com.sunny.jobconsole.admin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@SpringBootApplication
public class JobConsoleAdminApplication {

	public static void main(String[] args) {
        SpringApplication.run(JobConsoleAdminApplication.class, args);
	}

}

package com.arborkernel;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Arbor Kernel - capability-based authorization, trust tracking and input
 * sanitization for autonomous agents.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
@EnableAspectJAutoProxy
@Slf4j
public class ArborKernelApplication {

    public static void main(String[] args) {
        log.info("Starting Arbor Kernel");
        SpringApplication.run(ArborKernelApplication.class, args);
    }
}

package com.arborkernel.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded platform-thread pool for work the kernel runs under a deadline:
 * DNS lookups for SSRF checks and timed reflexes.
 *
 * <p>Tasks are cancelled by interruption when their deadline passes, so the
 * pool stays small. Overflow is aborted rather than run on the caller, which
 * would defeat the deadline; the caller turns the rejection into a denial.
 */
@Configuration
@Slf4j
public class ExecutorConfiguration {

    public static final String KERNEL_EXECUTOR = "kernelExecutor";

    @Bean(name = KERNEL_EXECUTOR)
    public ThreadPoolTaskExecutor kernelExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();
        log.info("Configuring kernel executor with {} core threads", processors);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(processors);
        executor.setMaxPoolSize(processors * 4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("kernel-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }
}

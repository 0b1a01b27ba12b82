package com.codefarm.shorturl.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executor for access recording after a redirect.
 * <p>
 * Recording is best effort: when the queue is full the executor rejects the task with a
 * {@code TaskRejectedException}, which the caller logs and drops. Tasks still queued when
 * the process dies are lost.
 */
@Configuration
@EnableConfigurationProperties(ShortUrlProperties.class)
public class AsyncConfig {

    public static final String ACCESS_EXECUTOR_NAME = "accessRecordingExecutor";

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Bean(name = ACCESS_EXECUTOR_NAME)
    public Executor accessRecordingExecutor(ShortUrlProperties properties) {
        ShortUrlProperties.Access.Executor settings = properties.access().executor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(settings.corePoolSize());
        executor.setMaxPoolSize(settings.maxPoolSize());
        executor.setQueueCapacity(settings.queueCapacity());
        executor.setThreadNamePrefix("Access-");

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);

        executor.initialize();

        log.info("Access recording executor initialized: core={}, max={}, queue={}",
                settings.corePoolSize(), settings.maxPoolSize(), settings.queueCapacity());
        return executor;
    }
}

package com.credentialguard.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker executor for blocking credential retrievals.
 *
 * <p>Ceremonies wait on a human, so one worker is enough: the coordinator joins
 * concurrent callers into the running ceremony and nothing queues behind it in
 * normal use. A full queue or a shut-down executor rejects the task; ceremonies
 * never run on the caller's thread.
 */
@AutoConfiguration
@EnableConfigurationProperties(CredentialGuardProperties.class)
@Slf4j
public class RetrievalExecutorConfiguration {

    public static final String EXECUTOR_BEAN_NAME = "credentialRetrievalExecutor";

    @Bean(name = EXECUTOR_BEAN_NAME)
    @ConditionalOnMissingBean(name = EXECUTOR_BEAN_NAME)
    public ThreadPoolTaskExecutor credentialRetrievalExecutor(CredentialGuardProperties properties) {
        log.info("Configuring credential retrieval executor");

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(properties.getRetrievalExecutor().getQueueCapacity());
        executor.setThreadNamePrefix("credential-retrieval-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        return executor;
    }
}

package com.gt.vocab.conf;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    public static final String EXTERNAL_CALL_EXECUTOR = "externalCallExecutor";

    // Content generation and answer judging calls; the only calls that wait on the network.
    // A full pool rejects instead of running the call on the waiting thread.
    @Bean(name = EXTERNAL_CALL_EXECUTOR)
    public Executor externalCallExecutor(@Value("${vocab.async.external.corePoolSize:4}") int corePoolSize,
                                         @Value("${vocab.async.external.maxPoolSize:8}") int maxPoolSize,
                                         @Value("${vocab.async.external.queueCapacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("external-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}

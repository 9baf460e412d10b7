package com.edwardjones.personnelsync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Slf4j
@Configuration
public class DispatchConfig {

    /**
     * Pool the individual create/update/delete calls run on. The batch timer paces how fast work is
     * handed to it, so the queue is left unbounded.
     */
    @Bean
    @Qualifier("syncApplyExecutor")
    public ThreadPoolTaskExecutor syncApplyExecutor(SyncProperties properties) {
        int threads = Math.max(1, properties.getApplyThreads());
        log.info("Initializing sync apply executor with {} threads", threads);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("sync-apply-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}

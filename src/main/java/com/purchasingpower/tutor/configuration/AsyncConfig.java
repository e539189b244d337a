package com.purchasingpower.tutor.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pool for multi-agent collaboration fan-out.
 *
 * Each participating agent's provider call runs on its own task so a slow or failing
 * backend never blocks the others.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "collaborationExecutor")
    public Executor collaborationExecutor(AppProperties props) {
        int maxAgents = props.getTutor().getMaxCollaboratingAgents();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxAgents);
        executor.setMaxPoolSize(maxAgents * 4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("tutor-collab-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("Collaboration executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }
}

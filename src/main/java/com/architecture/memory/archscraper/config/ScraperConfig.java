package com.architecture.memory.archscraper.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@Slf4j
public class ScraperConfig {

    @Value("${scraper.fetch.parallelism:1}")
    private int fetchParallelism;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs per-template fetch and parse work. With parallelism 1 the work stays on the calling thread.
     */
    @Bean
    public TaskExecutor templateFetchExecutor() {
        if (fetchParallelism <= 1) {
            return new SyncTaskExecutor();
        }

        log.info("Fetching templates with {} worker threads", fetchParallelism);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(fetchParallelism);
        executor.setMaxPoolSize(fetchParallelism);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("template-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}

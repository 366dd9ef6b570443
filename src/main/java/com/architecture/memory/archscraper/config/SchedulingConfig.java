package com.architecture.memory.archscraper.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
public class SchedulingConfig {
    // Scheduled scrape runs only when scraper.schedule.enabled is true
}

package com.architecture.memory.archscraper.scheduler;

import com.architecture.memory.archscraper.dto.ScrapeRequest;
import com.architecture.memory.archscraper.dto.ScrapeResult;
import com.architecture.memory.archscraper.service.ArchitectureScrapeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scrapes the configured sources on a cron schedule. Disabled unless scraper.schedule.enabled is set.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "scraper.schedule", name = "enabled", havingValue = "true")
public class ScheduledScrapeRunner {

    private final ArchitectureScrapeService scrapeService;

    @Scheduled(cron = "${scraper.schedule.cron:0 0 3 * * *}")
    public void runScheduledScrape() {
        log.info("Running scheduled scrape...");
        try {
            ScrapeResult result = scrapeService.scrape(new ScrapeRequest());
            log.info("Scheduled scrape completed: status={}, written={}, errors={}",
                    result.getSummary().getStatus(),
                    result.getSummary().getDocumentsWritten(),
                    result.getSummary().getErrors().size());
        } catch (Exception e) {
            log.error("Scheduled scrape failed: {}", e.getMessage(), e);
        }
    }
}

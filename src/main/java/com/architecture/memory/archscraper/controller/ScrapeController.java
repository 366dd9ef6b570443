package com.architecture.memory.archscraper.controller;

import com.architecture.memory.archscraper.dto.ScrapeRequest;
import com.architecture.memory.archscraper.dto.ScrapeResult;
import com.architecture.memory.archscraper.service.ArchitectureScrapeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scrape")
@RequiredArgsConstructor
@Slf4j
public class ScrapeController {

    private final ArchitectureScrapeService scrapeService;

    /**
     * Runs one scrape pass synchronously. An empty body scrapes the configured sources.
     */
    @PostMapping
    public ResponseEntity<ScrapeResult> scrape(@Valid @RequestBody(required = false) ScrapeRequest request) {
        ScrapeRequest effective = request != null ? request : new ScrapeRequest();
        log.info("Scrape requested: sources={}, limit={}, save={}",
                effective.getSources(), effective.getLimit(), effective.isSave());
        return ResponseEntity.ok(scrapeService.scrape(effective));
    }
}

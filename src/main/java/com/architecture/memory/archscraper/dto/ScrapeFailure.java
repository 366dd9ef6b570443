package com.architecture.memory.archscraper.dto;

import com.architecture.memory.archscraper.exception.FailureCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One failure captured during a scrape pass, attributed to the source and file that caused it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapeFailure {

    private String source;

    private String path;

    private FailureCategory category;

    private String message;

    public String describe() {
        String location = path != null ? source + "/" + path : source;
        return String.format("[%s] %s: %s", category, location, message);
    }
}

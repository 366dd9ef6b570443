package com.architecture.memory.archscraper.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapeSummary {

    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_PARTIAL_SUCCESS = "PARTIAL_SUCCESS";
    public static final String STATUS_FAILED = "FAILED";

    private String status;
    private String strategy;
    private int sourcesProcessed;
    private int candidatesFound;
    private int documentsNormalized;
    private int documentsWritten;
    private int filesSkipped;
    private int storageFailures;
    private boolean cancelled;

    @Builder.Default
    private List<ScrapeFailure> errors = new ArrayList<>();

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
}

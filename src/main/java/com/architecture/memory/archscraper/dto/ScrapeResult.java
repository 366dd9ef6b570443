package com.architecture.memory.archscraper.dto;

import com.architecture.memory.archscraper.model.ArchitectureDocument;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapeResult {

    private ScrapeSummary summary;

    @Builder.Default
    private List<ArchitectureDocument> documents = new ArrayList<>();
}

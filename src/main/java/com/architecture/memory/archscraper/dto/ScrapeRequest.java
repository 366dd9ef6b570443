package com.architecture.memory.archscraper.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapeRequest {

    // "Owner/Repo[:subdir]"; configured sources are used when empty
    private List<String> sources;

    @Min(0)
    @Max(10000)
    private Integer limit;

    @Builder.Default
    private boolean save = true;
}

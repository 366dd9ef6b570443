package com.architecture.memory.archscraper.dto;

import com.architecture.memory.archscraper.model.ArchitectureDocument;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchitectureListResponse {
    private List<ArchitectureDocument> items;
    private int page;
    private int size;
    private long total;
}

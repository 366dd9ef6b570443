package com.architecture.memory.archscraper.service;

import com.architecture.memory.archscraper.dto.ArchitectureListResponse;
import com.architecture.memory.archscraper.dto.ArchitectureQuery;
import com.architecture.memory.archscraper.exception.ArchitectureNotFoundException;
import com.architecture.memory.archscraper.model.ArchitectureDocument;
import com.architecture.memory.archscraper.repository.ArchitectureDocumentRepository;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ArchitectureQueryServiceTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private ArchitectureDocumentRepository repository;

    @InjectMocks
    private ArchitectureQueryService queryService;

    @Test
    void getById_throwsWhenMissing() {
        when(repository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> queryService.getById("nope"))
                .isInstanceOf(ArchitectureNotFoundException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void search_appliesPagingAndReturnsTotal() {
        ArchitectureDocument document = ArchitectureDocument.builder().id("1").name("webapp").build();
        when(mongoTemplate.count(any(Query.class), eq(ArchitectureDocument.class))).thenReturn(51L);
        when(mongoTemplate.find(any(Query.class), eq(ArchitectureDocument.class))).thenReturn(List.of(document));

        ArchitectureListResponse response = queryService.search(ArchitectureQuery.builder().page(2).size(25).build());

        ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(captor.capture(), eq(ArchitectureDocument.class));
        assertThat(captor.getValue().getSkip()).isEqualTo(50L);
        assertThat(captor.getValue().getLimit()).isEqualTo(25);
        assertThat(response.getTotal()).isEqualTo(51L);
        assertThat(response.getItems()).containsExactly(document);
    }

    @Test
    void search_capsPageSize() {
        when(mongoTemplate.find(any(Query.class), eq(ArchitectureDocument.class))).thenReturn(List.of());

        ArchitectureListResponse response = queryService.search(ArchitectureQuery.builder().size(5000).build());

        assertThat(response.getSize()).isEqualTo(ArchitectureQueryService.MAX_PAGE_SIZE);
    }

    @Test
    void buildQuery_combinesFilters() {
        Query query = queryService.buildQuery(ArchitectureQuery.builder()
                .q("web")
                .minResources(3)
                .resourceType("Microsoft.Web/sites")
                .owner("Azure")
                .build());

        List<?> clauses = (List<?>) query.getQueryObject().get("$and");
        assertThat(clauses)
                .extracting(clause -> ((Document) clause).keySet().iterator().next())
                .containsExactly("name", "resourceCount", "resourceTypes", "sourceOwner");
    }

    @Test
    void buildQuery_withoutFiltersMatchesEverything() {
        assertThat(queryService.buildQuery(new ArchitectureQuery()).getQueryObject()).isEmpty();
    }

    @Test
    void buildSort_fallsBackToNameForUnknownField() {
        Sort sort = queryService.buildSort(ArchitectureQuery.builder().sortBy("password").sortDir("desc").build());

        assertThat(sort.getOrderFor("name")).isNotNull();
        assertThat(sort.getOrderFor("name").getDirection()).isEqualTo(Sort.Direction.DESC);
        assertThat(sort.getOrderFor("password")).isNull();
    }
}

package com.architecture.memory.archscraper.service.sink;

import com.architecture.memory.archscraper.exception.StorageException;
import com.architecture.memory.archscraper.model.ArchitectureDocument;
import com.architecture.memory.archscraper.repository.ArchitectureDocumentRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoArchitectureSinkTest {

    private static final LocalDateTime FIRST_SCRAPE = LocalDateTime.of(2024, 1, 1, 3, 0);
    private static final LocalDateTime SECOND_SCRAPE = LocalDateTime.of(2024, 5, 1, 3, 0);

    @Mock
    private ArchitectureDocumentRepository repository;

    @InjectMocks
    private MongoArchitectureSink sink;

    @Test
    void upsert_newDocumentGetsCreatedAtFromScrapedAt() {
        when(repository.findById("id-1")).thenReturn(Optional.empty());

        sink.upsert(document(SECOND_SCRAPE));

        ArgumentCaptor<ArchitectureDocument> captor = ArgumentCaptor.forClass(ArchitectureDocument.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getCreatedAt()).isEqualTo(SECOND_SCRAPE);
    }

    @Test
    void upsert_replacementKeepsOriginalCreatedAt() {
        ArchitectureDocument existing = document(FIRST_SCRAPE);
        existing.setCreatedAt(FIRST_SCRAPE);
        when(repository.findById("id-1")).thenReturn(Optional.of(existing));

        sink.upsert(document(SECOND_SCRAPE));

        ArgumentCaptor<ArchitectureDocument> captor = ArgumentCaptor.forClass(ArchitectureDocument.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getCreatedAt()).isEqualTo(FIRST_SCRAPE);
        assertThat(captor.getValue().getScrapedAt()).isEqualTo(SECOND_SCRAPE);
    }

    @Test
    void upsert_wrapsDatabaseFailures() {
        when(repository.findById("id-1")).thenReturn(Optional.empty());
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> sink.upsert(document(SECOND_SCRAPE)))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("id-1");
    }

    @Test
    void upsert_rejectsDocumentWithoutId() {
        ArchitectureDocument document = document(SECOND_SCRAPE);
        document.setId(null);

        assertThatThrownBy(() -> sink.upsert(document)).isInstanceOf(StorageException.class);
        verify(repository, never()).save(any());
    }

    private static ArchitectureDocument document(LocalDateTime scrapedAt) {
        return ArchitectureDocument.builder()
                .id("id-1")
                .name("webapp")
                .sourceOwner("Org")
                .sourceRepo("Repo")
                .sourcePath("examples/webapp/azuredeploy.json")
                .scrapedAt(scrapedAt)
                .build();
    }
}

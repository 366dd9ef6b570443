package com.architecture.memory.archscraper.service;

import com.architecture.memory.archscraper.dto.ScrapeFailure;
import com.architecture.memory.archscraper.dto.ScrapeRequest;
import com.architecture.memory.archscraper.dto.ScrapeResult;
import com.architecture.memory.archscraper.dto.ScrapeSummary;
import com.architecture.memory.archscraper.exception.AuthenticationException;
import com.architecture.memory.archscraper.exception.ConfigurationException;
import com.architecture.memory.archscraper.exception.FailureCategory;
import com.architecture.memory.archscraper.exception.ScrapeCancelledException;
import com.architecture.memory.archscraper.exception.ScraperException;
import com.architecture.memory.archscraper.exception.StorageException;
import com.architecture.memory.archscraper.model.ArchitectureDocument;
import com.architecture.memory.archscraper.model.FileEntry;
import com.architecture.memory.archscraper.model.ParsedTemplate;
import com.architecture.memory.archscraper.model.SourceSpec;
import com.architecture.memory.archscraper.model.TemplateMetadata;
import com.architecture.memory.archscraper.service.sink.ArchitectureSink;
import com.architecture.memory.archscraper.service.source.SourceSpecResolver;
import com.architecture.memory.archscraper.service.template.ArchitectureNormalizer;
import com.architecture.memory.archscraper.service.template.ArmTemplateParser;
import com.architecture.memory.archscraper.service.template.TemplateCandidateFilter;
import com.architecture.memory.archscraper.service.template.TemplateContentFetcher;
import com.architecture.memory.archscraper.service.template.TemplateMetadataReader;
import com.architecture.memory.archscraper.service.traversal.TraversalMode;
import com.architecture.memory.archscraper.service.traversal.TreeTraversalStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs one scrape pass over the configured sources:
 * 1. Resolve source strings
 * 2. List each repository with the selected traversal strategy
 * 3. Filter template candidates
 * 4. Fetch, parse and normalize each candidate independently
 * 5. Upsert the documents
 *
 * Failures are attributed to their source or file and collected in the summary; a pass always
 * completes with a result unless no source could be resolved at all.
 */
@Service
@Slf4j
public class ArchitectureScrapeService {

    private final SourceSpecResolver sourceSpecResolver;
    private final TreeTraversalStrategy traversalStrategy;
    private final TemplateCandidateFilter candidateFilter;
    private final TemplateContentFetcher contentFetcher;
    private final ArmTemplateParser templateParser;
    private final TemplateMetadataReader metadataReader;
    private final ArchitectureNormalizer normalizer;
    private final ArchitectureSink sink;
    private final Executor fetchExecutor;
    private final Clock clock;
    private final List<String> defaultSources;
    private final int defaultLimit;
    private final Duration passTimeout;
    private final boolean metadataEnabled;

    public ArchitectureScrapeService(SourceSpecResolver sourceSpecResolver,
                                     TreeTraversalStrategy traversalStrategy,
                                     TemplateCandidateFilter candidateFilter,
                                     TemplateContentFetcher contentFetcher,
                                     ArmTemplateParser templateParser,
                                     TemplateMetadataReader metadataReader,
                                     ArchitectureNormalizer normalizer,
                                     ArchitectureSink sink,
                                     @Qualifier("templateFetchExecutor") Executor fetchExecutor,
                                     Clock clock,
                                     @Value("${scraper.sources:}") List<String> defaultSources,
                                     @Value("${scraper.limit:25}") int defaultLimit,
                                     @Value("${scraper.pass-timeout:10m}") Duration passTimeout,
                                     @Value("${scraper.metadata.enabled:true}") boolean metadataEnabled) {
        this.sourceSpecResolver = sourceSpecResolver;
        this.traversalStrategy = traversalStrategy;
        this.candidateFilter = candidateFilter;
        this.contentFetcher = contentFetcher;
        this.templateParser = templateParser;
        this.metadataReader = metadataReader;
        this.normalizer = normalizer;
        this.sink = sink;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
        this.defaultSources = defaultSources;
        this.defaultLimit = defaultLimit;
        this.passTimeout = passTimeout;
        this.metadataEnabled = metadataEnabled;
    }

    public TraversalMode getTraversalMode() {
        return traversalStrategy.mode();
    }

    public ScrapeResult scrape(ScrapeRequest request) {
        return scrape(request, ScrapeContext.withTimeout(clock, passTimeout));
    }

    public ScrapeResult scrape(ScrapeRequest request, ScrapeContext context) {
        ScrapeRequest effective = request != null ? request : new ScrapeRequest();
        List<String> sources = effective.getSources() != null && !effective.getSources().isEmpty()
                ? effective.getSources()
                : defaultSources;

        SourceSpecResolver.Resolution resolution = sourceSpecResolver.resolveAll(sources);
        if (resolution.specs().isEmpty()) {
            throw new ConfigurationException("No valid sources to scrape: " + sources);
        }

        PassTally tally = new PassTally(clock);
        resolution.failures().forEach((source, error) ->
                tally.fail(source, null, error.getCategory(), error.getMessage()));

        int limit = effective.getLimit() != null ? effective.getLimit() : defaultLimit;
        int perSourceLimit = limit > 0 ? Math.max(1, limit / resolution.specs().size()) : 0;

        log.info("Starting scrape of {} source(s) with {} strategy (limit={}, save={})",
                resolution.specs().size(), traversalStrategy.mode(), limit, effective.isSave());

        for (SourceSpec spec : resolution.specs()) {
            if (context.isCancelled()) {
                log.warn("Scrape pass cancelled before {}", spec);
                tally.cancelled = true;
                break;
            }

            try {
                scrapeSource(spec, perSourceLimit, effective.isSave(), context, tally);
            } catch (ScrapeCancelledException e) {
                log.warn("Scrape pass cancelled while processing {}: {}", spec, e.getMessage());
                tally.cancelled = true;
                break;
            } catch (AuthenticationException e) {
                tally.fail(spec.toString(), null, e.getCategory(), e.getMessage());
                if (traversalStrategy.mode() == TraversalMode.BULK) {
                    log.error("Credential rejected by GitHub, aborting scrape pass: {}", e.getMessage());
                    break;
                }
                log.error("Credential rejected while scraping {}: {}", spec, e.getMessage());
            } catch (ScraperException e) {
                log.error("Failed to scrape {}: {}", spec, e.getMessage());
                tally.fail(spec.toString(), null, e.getCategory(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected error while scraping {}", spec, e);
                tally.fail(spec.toString(), null, FailureCategory.UNEXPECTED, e.getMessage());
            }
            tally.sourcesProcessed++;
        }

        ScrapeSummary summary = tally.toSummary(traversalStrategy.mode());
        log.info("Scrape pass finished: status={}, sources={}, candidates={}, normalized={}, written={}, skipped={}, errors={}, cancelled={}",
                summary.getStatus(), summary.getSourcesProcessed(), summary.getCandidatesFound(),
                summary.getDocumentsNormalized(), summary.getDocumentsWritten(), summary.getFilesSkipped(),
                summary.getErrors().size(), summary.isCancelled());

        return ScrapeResult.builder()
                .summary(summary)
                .documents(tally.documents)
                .build();
    }

    private void scrapeSource(SourceSpec spec, int perSourceLimit, boolean save, ScrapeContext context, PassTally tally) {
        List<FileEntry> listing = traversalStrategy.listFiles(
                spec, context, candidateFilter::isTemplateFile, perSourceLimit);
        List<FileEntry> candidates = candidateFilter.filter(listing);
        if (perSourceLimit > 0 && candidates.size() > perSourceLimit) {
            log.info("{} has {} template candidates, keeping the first {}", spec, candidates.size(), perSourceLimit);
            candidates = candidates.subList(0, perSourceLimit);
        }
        tally.candidatesFound += candidates.size();
        log.info("Found {} template candidate(s) in {}", candidates.size(), spec);

        Map<String, FileEntry> filesByPath = new LinkedHashMap<>();
        for (FileEntry entry : listing) {
            filesByPath.put(entry.path(), entry);
        }

        List<CompletableFuture<CandidateOutcome>> pending = new ArrayList<>();
        for (FileEntry candidate : candidates) {
            pending.add(CompletableFuture.supplyAsync(
                    () -> processCandidate(spec, candidate, filesByPath, context), fetchExecutor));
        }

        AuthenticationException authFailure = null;
        for (CompletableFuture<CandidateOutcome> future : pending) {
            CandidateOutcome outcome = future.join();

            if (outcome.document() != null) {
                tally.documentsNormalized++;
                tally.documents.add(outcome.document());
                if (save) {
                    store(spec, outcome.document(), tally);
                }
                continue;
            }

            ScraperException error = outcome.error();
            if (error instanceof ScrapeCancelledException) {
                tally.cancelled = true;
            } else if (error instanceof AuthenticationException authenticationException) {
                if (authFailure == null) {
                    authFailure = authenticationException;
                }
            } else {
                tally.filesSkipped++;
                tally.fail(spec.toString(), outcome.path(), error.getCategory(), error.getMessage());
            }
        }

        if (authFailure != null) {
            throw authFailure;
        }
        if (tally.cancelled) {
            throw new ScrapeCancelledException("Cancelled while fetching templates of " + spec);
        }
    }

    private CandidateOutcome processCandidate(SourceSpec spec,
                                              FileEntry candidate,
                                              Map<String, FileEntry> filesByPath,
                                              ScrapeContext context) {
        try {
            String content = contentFetcher.fetch(candidate, context);
            ParsedTemplate template = templateParser.parse(content);
            TemplateMetadata metadata = metadataEnabled
                    ? metadataReader.readFor(candidate, filesByPath, context).orElse(null)
                    : null;

            ArchitectureDocument document = normalizer.normalize(spec, candidate, template, metadata);
            log.debug("Normalized {} -> {} ({} resource types)", candidate.path(), document.getName(), document.getResourceCount());
            return CandidateOutcome.normalized(candidate.path(), document);
        } catch (ScrapeCancelledException | AuthenticationException e) {
            return CandidateOutcome.failed(candidate.path(), e);
        } catch (ScraperException e) {
            log.warn("Skipping {} in {}: {}", candidate.path(), spec, e.getMessage());
            return CandidateOutcome.failed(candidate.path(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error processing {} in {}", candidate.path(), spec, e);
            return CandidateOutcome.failed(candidate.path(),
                    new ScraperException(FailureCategory.UNEXPECTED, String.valueOf(e.getMessage()), e));
        }
    }

    private void store(SourceSpec spec, ArchitectureDocument document, PassTally tally) {
        try {
            sink.upsert(document);
            tally.documentsWritten++;
        } catch (StorageException e) {
            log.error("Failed to store {} from {}: {}", document.getSourcePath(), spec, e.getMessage());
            tally.storageFailures++;
            tally.fail(spec.toString(), document.getSourcePath(), e.getCategory(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error storing {} from {}", document.getSourcePath(), spec, e);
            tally.storageFailures++;
            tally.fail(spec.toString(), document.getSourcePath(), FailureCategory.STORAGE, e.getMessage());
        }
    }

    private record CandidateOutcome(String path, ArchitectureDocument document, ScraperException error) {

        static CandidateOutcome normalized(String path, ArchitectureDocument document) {
            return new CandidateOutcome(path, document, null);
        }

        static CandidateOutcome failed(String path, ScraperException error) {
            return new CandidateOutcome(path, null, error);
        }
    }

    /**
     * Counters of one pass. Only touched from the thread running the pass.
     */
    private static final class PassTally {
        private final LocalDateTime startedAt;
        private final Clock clock;
        private final List<ArchitectureDocument> documents = new ArrayList<>();
        private final List<ScrapeFailure> errors = new ArrayList<>();
        private int sourcesProcessed;
        private int candidatesFound;
        private int documentsNormalized;
        private int documentsWritten;
        private int filesSkipped;
        private int storageFailures;
        private boolean cancelled;

        private PassTally(Clock clock) {
            this.clock = clock;
            this.startedAt = LocalDateTime.now(clock);
        }

        private void fail(String source, String path, FailureCategory category, String message) {
            errors.add(ScrapeFailure.builder()
                    .source(source)
                    .path(path)
                    .category(category)
                    .message(message)
                    .build());
        }

        private ScrapeSummary toSummary(TraversalMode mode) {
            String status;
            if (errors.isEmpty() && !cancelled) {
                status = ScrapeSummary.STATUS_SUCCESS;
            } else if (documentsNormalized > 0) {
                status = ScrapeSummary.STATUS_PARTIAL_SUCCESS;
            } else {
                status = ScrapeSummary.STATUS_FAILED;
            }

            return ScrapeSummary.builder()
                    .status(status)
                    .strategy(mode.name())
                    .sourcesProcessed(sourcesProcessed)
                    .candidatesFound(candidatesFound)
                    .documentsNormalized(documentsNormalized)
                    .documentsWritten(documentsWritten)
                    .filesSkipped(filesSkipped)
                    .storageFailures(storageFailures)
                    .cancelled(cancelled)
                    .errors(new ArrayList<>(errors))
                    .startedAt(startedAt)
                    .completedAt(LocalDateTime.now(clock))
                    .build();
        }
    }
}

package com.architecture.memory.archscraper.service.traversal;

import com.architecture.memory.archscraper.model.FileEntry;
import com.architecture.memory.archscraper.model.SourceSpec;
import com.architecture.memory.archscraper.service.ScrapeContext;

import java.util.List;
import java.util.function.Predicate;

/**
 * Lists the files of one repository source. Implementations route every call through the shared
 * guarded client and return only entries inside the source's subdirectory.
 */
public interface TreeTraversalStrategy {

    TraversalMode mode();

    List<FileEntry> listFiles(SourceSpec spec, ScrapeContext context);

    /**
     * Lists files, allowing the strategy to stop once {@code stopAfter} directories holding a
     * template file have been listed. Directories are always listed whole, so siblings of every
     * template found are included. {@code stopAfter <= 0} lists everything.
     */
    default List<FileEntry> listFiles(SourceSpec spec,
                                      ScrapeContext context,
                                      Predicate<FileEntry> templateFile,
                                      int stopAfter) {
        return listFiles(spec, context);
    }

    default List<FileEntry> listFiles(SourceSpec spec) {
        return listFiles(spec, ScrapeContext.unbounded());
    }
}

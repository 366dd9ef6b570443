package com.architecture.memory.archscraper.service.traversal;

public enum TraversalMode {
    /** One recursive git-tree call per repository; needs a credential. */
    BULK,
    /** One contents call per directory; works anonymously. */
    WALKER
}

package com.architecture.memory.archscraper.service.traversal;

/**
 * Chooses between bulk listing and the directory walker. Evaluated once per configuration.
 */
public final class TraversalStrategySelector {

    private TraversalStrategySelector() {
    }

    public static TraversalMode select(boolean hasCredential, boolean forceWalker) {
        return !hasCredential || forceWalker ? TraversalMode.WALKER : TraversalMode.BULK;
    }

    public static TreeTraversalStrategy choose(boolean hasCredential,
                                               boolean forceWalker,
                                               TreeTraversalStrategy bulk,
                                               TreeTraversalStrategy walker) {
        return select(hasCredential, forceWalker) == TraversalMode.WALKER ? walker : bulk;
    }
}

package com.architecture.memory.archscraper.model;

/**
 * One configured repository to scan, optionally restricted to a subdirectory.
 *
 * @param owner  repository owner (user or organization)
 * @param repo   repository name
 * @param subdir normalized subdirectory without leading or trailing slashes, or null for the whole repository
 */
public record SourceSpec(String owner, String repo, String subdir) {

    public boolean hasSubdir() {
        return subdir != null && !subdir.isEmpty();
    }

    public String fullName() {
        return owner + "/" + repo;
    }

    /**
     * Whether a repository-relative path lies inside the subdirectory restriction.
     * Matching is per path segment, so {@code examples2/x} is not inside {@code examples}.
     */
    public boolean contains(String path) {
        if (!hasSubdir()) {
            return true;
        }
        if (path == null) {
            return false;
        }
        return path.equals(subdir) || path.startsWith(subdir + "/");
    }

    @Override
    public String toString() {
        return hasSubdir() ? fullName() + ":" + subdir : fullName();
    }
}

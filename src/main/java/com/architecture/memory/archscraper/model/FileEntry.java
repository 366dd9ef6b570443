package com.architecture.memory.archscraper.model;

/**
 * A file or directory reported by a repository listing.
 *
 * @param path        repository-relative path
 * @param rawRef      URL from which the content can be retrieved (blob or contents API, or a raw download URL)
 * @param isDirectory whether the entry is a directory
 */
public record FileEntry(String path, String rawRef, boolean isDirectory) {

    public static FileEntry file(String path, String rawRef) {
        return new FileEntry(path, rawRef, false);
    }

    public static FileEntry directory(String path, String rawRef) {
        return new FileEntry(path, rawRef, true);
    }

    public String fileName() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /**
     * Parent directory path, or an empty string for entries at the repository root.
     */
    public String parentPath() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(0, slash) : "";
    }

    public String parentName() {
        String parent = parentPath();
        int slash = parent.lastIndexOf('/');
        return slash >= 0 ? parent.substring(slash + 1) : parent;
    }
}

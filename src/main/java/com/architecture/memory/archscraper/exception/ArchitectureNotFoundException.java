package com.architecture.memory.archscraper.exception;

public class ArchitectureNotFoundException extends RuntimeException {

    public ArchitectureNotFoundException(String message) {
        super(message);
    }
}

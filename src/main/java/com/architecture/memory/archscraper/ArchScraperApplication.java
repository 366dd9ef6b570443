package com.architecture.memory.archscraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ArchScraperApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArchScraperApplication.class, args);
    }
}

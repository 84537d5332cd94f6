package com.agencyos.searchsync.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Standalone host for the search sync beans; embedding applications scan
 * {@code com.agencyos.searchsync} instead.
 */
@SpringBootApplication(scanBasePackages = "com.agencyos.searchsync")
public class SearchSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(SearchSyncApplication.class, args);
    }
}

package com.newsharvest.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * NewsHarvest Scraper
 *
 * Batch scraper for news listing pages
 * - Story discovery from embedded JSON trees and server-rendered HTML cards
 * - Sequential detail-page fetching with a fixed delay between requests
 * - Idempotent local media cache and one JSON artifact per source
 */
@SpringBootApplication
public class ScraperApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = new SpringApplicationBuilder(ScraperApplication.class)
                .web(WebApplicationType.NONE)
                .run(args);
        System.exit(SpringApplication.exit(context));
    }
}

package com.newsharvest.scraper.cli;

import com.newsharvest.scraper.dto.ScrapeReport;
import com.newsharvest.scraper.exception.UnknownSourceException;
import com.newsharvest.scraper.service.ScrapeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Command line entry point.
 * <pre>
 *   --source=&lt;name&gt;     scrape one source
 *   --all               scrape every configured source
 *   --max-stories=&lt;n&gt;  bound the detail pages fetched per source
 *   --list              print the available sources (also the default)
 * </pre>
 * Any completed run exits with 0, even with no stories; an unknown source name or a
 * malformed option exits with {@value #EXIT_USAGE_ERROR}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "scraper.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScrapeCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE_ERROR = 2;

    static final String OPT_SOURCE = "source";
    static final String OPT_ALL = "all";
    static final String OPT_MAX_STORIES = "max-stories";
    static final String OPT_LIST = "list";

    private final ScrapeService scrapeService;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        Integer maxStories;
        try {
            maxStories = maxStories(args);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            exitCode = EXIT_USAGE_ERROR;
            return;
        }

        String source = singleValue(args, OPT_SOURCE);
        if (source != null) {
            try {
                ScrapeReport report = scrapeService.scrape(source, maxStories);
                log.info("Scraped {} stories from {}", report.storyCount(), report.source());
            } catch (UnknownSourceException e) {
                log.error(e.getMessage());
                exitCode = EXIT_USAGE_ERROR;
            }
        } else if (args.containsOption(OPT_ALL)) {
            Map<String, ScrapeReport> reports = scrapeService.scrapeAll(maxStories);
            log.info("Scraped {} sources", reports.size());
        } else {
            printUsage();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void printUsage() {
        List<String> sources = scrapeService.availableSources();
        log.info("Available news sources: {}", String.join(", ", sources));
        log.info("Usage: --source=<{}> | --all [--max-stories=<n>]", String.join("|", sources));
    }

    static Integer maxStories(ApplicationArguments args) {
        String raw = singleValue(args, OPT_MAX_STORIES);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value <= 0) {
                throw new IllegalArgumentException("--max-stories must be positive: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--max-stories is not a number: " + raw);
        }
    }

    private static String singleValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }
}

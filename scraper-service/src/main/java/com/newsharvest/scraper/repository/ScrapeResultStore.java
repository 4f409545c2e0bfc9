package com.newsharvest.scraper.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.newsharvest.scraper.config.ScraperProperties;
import com.newsharvest.scraper.dto.FullRecord;
import com.newsharvest.scraper.dto.ScrapeArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Writes and reads scrape artifacts as pretty-printed UTF-8 JSON.
 * Non-ASCII text is written as is, not escaped.
 */
@Slf4j
@Repository
public class ScrapeResultStore {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Path outputDir;

    @Autowired
    public ScrapeResultStore(ObjectMapper objectMapper, Clock clock, ScraperProperties properties) {
        this(objectMapper, clock, Paths.get(properties.getStorage().getOutputDir()));
    }

    public ScrapeResultStore(ObjectMapper objectMapper, Clock clock, Path outputDir) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.clock = clock;
        this.outputDir = outputDir;
    }

    /**
     * Saves under a timestamped file name in the output directory.
     */
    public Path save(String source, List<FullRecord> stories) {
        return save(source, stories, outputDir.resolve(defaultFileName(source, LocalDateTime.now(clock))));
    }

    /**
     * @return the written file
     * @throws UncheckedIOException when the file cannot be written
     */
    public Path save(String source, List<FullRecord> stories, Path destination) {
        ScrapeArtifact artifact = ScrapeArtifact.of(source, OffsetDateTime.now(clock), stories);
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(destination.toFile(), artifact);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write scrape artifact " + destination, e);
        }
        log.info("Data successfully saved to {}", destination);
        return destination;
    }

    /**
     * @return the artifact, or empty when the file is missing or unreadable
     */
    public Optional<ScrapeArtifact> load(Path path) {
        if (!Files.isRegularFile(path)) {
            log.warn("File {} not found.", path);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), ScrapeArtifact.class));
        } catch (IOException e) {
            log.warn("Error loading JSON file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * e.g. {@code prothom_alo_education_news_20240101_093000.json}
     */
    public static String defaultFileName(String source, LocalDateTime timestamp) {
        String safe = source.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\w\\s-]", "")
                .trim()
                .replaceAll("[-\\s]+", "_");
        if (safe.isEmpty()) {
            safe = "source";
        }
        return safe + "_news_" + FILE_TIMESTAMP.format(timestamp) + ".json";
    }
}

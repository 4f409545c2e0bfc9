package com.newsharvest.scraper.service.media;

import com.newsharvest.scraper.client.HttpFetcher;
import com.newsharvest.scraper.config.ScraperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Downloads story media into {@code {dataDir}/images/[{subdirectory}/]{slug}/{name}{ext}}.
 * <p>
 * A file that already exists is returned as is, without a request: the cache is
 * idempotent, not fresh. Bodies are written to a temporary sibling and moved into place
 * only once complete, so a failed download never leaves a file that a later call would
 * mistake for a cache hit.
 */
@Slf4j
@Service
public class MediaCacheService {

    static final String IMAGES_DIR = "images";
    static final String DEFAULT_EXTENSION = ".jpg";
    static final int MAX_EXTENSION_LENGTH = 4;

    private final HttpFetcher httpFetcher;
    private final Path dataRoot;

    @Autowired
    public MediaCacheService(HttpFetcher httpFetcher, ScraperProperties properties) {
        this(httpFetcher, Paths.get(properties.getStorage().getDataDir()));
    }

    public MediaCacheService(HttpFetcher httpFetcher, Path dataRoot) {
        this.httpFetcher = httpFetcher;
        this.dataRoot = dataRoot;
    }

    /**
     * Ensures the media at {@code url} is cached under ({@code slug}, {@code name}).
     *
     * @param subdirectory optional directory between {@code images/} and the slug
     * @return path relative to the data root, or empty when the download failed
     */
    public Optional<String> ensure(String url, String slug, String name, String subdirectory) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        try {
            Path target = targetPath(url, slug, name, subdirectory);
            Files.createDirectories(target.getParent());

            if (Files.exists(target)) {
                log.debug("Media already cached: {}", target);
                return Optional.of(relativize(target));
            }

            Path partial = target.resolveSibling(target.getFileName() + ".part");
            try {
                httpFetcher.download(url, partial);
                Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(partial);
            }

            log.info("Downloaded image: {}", target.getFileName());
            return Optional.of(relativize(target));
        } catch (IOException | RuntimeException e) {
            log.warn("Error downloading image {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<String> ensure(String url, String slug, String name) {
        return ensure(url, slug, name, null);
    }

    /**
     * Caches body images as {@code image_1, image_2, ...} in list order. Failed downloads
     * are omitted, so the result may be shorter than {@code urls}.
     */
    public List<String> ensureAll(List<String> urls, String slug, String subdirectory) {
        List<String> localPaths = new ArrayList<>();
        for (int i = 0; i < urls.size(); i++) {
            ensure(urls.get(i), slug, "image_" + (i + 1), subdirectory)
                    .ifPresent(localPaths::add);
        }
        return localPaths;
    }

    /**
     * Absolute target of a media file; a pure function of its arguments.
     */
    public Path targetPath(String url, String slug, String name, String subdirectory) {
        Path directory = dataRoot.resolve(IMAGES_DIR);
        if (subdirectory != null && !subdirectory.isBlank()) {
            directory = directory.resolve(subdirectory);
        }
        Path target = directory.resolve(slug).resolve(name + extensionOf(url)).normalize();
        if (!target.startsWith(directory.normalize())) {
            throw new IllegalArgumentException("Media path escapes the image directory: " + slug + "/" + name);
        }
        return target;
    }

    /**
     * Extension of the URL path including the dot, or {@code .jpg} when there is none or
     * it is longer than {@value #MAX_EXTENSION_LENGTH} characters.
     */
    public static String extensionOf(String url) {
        String path = url;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int fragment = path.indexOf('#');
        if (fragment >= 0) {
            path = path.substring(0, fragment);
        }
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        String extension = fileName.substring(dot);
        return extension.length() - 1 > MAX_EXTENSION_LENGTH ? DEFAULT_EXTENSION : extension;
    }

    private String relativize(Path target) {
        return dataRoot.relativize(target).toString().replace('\\', '/');
    }
}

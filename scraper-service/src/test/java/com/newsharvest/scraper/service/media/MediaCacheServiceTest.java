package com.newsharvest.scraper.service.media;

import com.newsharvest.scraper.client.FetchedPage;
import com.newsharvest.scraper.client.HttpFetcher;
import com.newsharvest.scraper.exception.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * MediaCacheService tests against a temporary data root
 */
class MediaCacheServiceTest {

    private static final String HERO_URL = "https://media.example.com/p/hero.png";
    private static final String BROKEN_URL = "https://media.example.com/p/broken.jpg";

    @TempDir
    Path dataRoot;

    private CountingFetcher fetcher;
    private MediaCacheService mediaCacheService;

    @BeforeEach
    void setUp() {
        fetcher = new CountingFetcher();
        fetcher.serve(HERO_URL, "png-bytes");
        fetcher.failAfterPartialWrite(BROKEN_URL);
        mediaCacheService = new MediaCacheService(fetcher, dataRoot);
    }

    @Nested
    @DisplayName("Idempotent caching")
    class Idempotency {

        @Test
        @DisplayName("A second call for the same story and name returns the same path without a request")
        void secondCallIsCacheHit() throws IOException {
            // when
            Optional<String> first = mediaCacheService.ensure(HERO_URL, "s1", "hero");
            Optional<String> second = mediaCacheService.ensure(HERO_URL, "s1", "hero");

            // then
            assertThat(first).contains("images/s1/hero.png");
            assertThat(second).isEqualTo(first);
            assertThat(fetcher.downloads(HERO_URL)).isEqualTo(1);
            assertThat(Files.readString(dataRoot.resolve("images/s1/hero.png"))).isEqualTo("png-bytes");
        }

        @Test
        @DisplayName("An existing file is returned even when the URL changed")
        void existingFileWinsOverNewUrl() throws IOException {
            // given
            Path existing = dataRoot.resolve("images/s1/hero.png");
            Files.createDirectories(existing.getParent());
            Files.writeString(existing, "old");

            // when
            Optional<String> path = mediaCacheService.ensure("https://media.example.com/other/hero.png", "s1", "hero");

            // then
            assertThat(path).contains("images/s1/hero.png");
            assertThat(fetcher.totalDownloads()).isZero();
            assertThat(Files.readString(existing)).isEqualTo("old");
        }

        @Test
        @DisplayName("Media of a source with a subdirectory is stored beneath it")
        void subdirectory() {
            // when
            Optional<String> path = mediaCacheService.ensure(HERO_URL, "story-1", "hero", "daily_star");

            // then
            assertThat(path).contains("images/daily_star/story-1/hero.png");
            assertThat(dataRoot.resolve("images/daily_star/story-1/hero.png")).exists();
        }

        @Test
        @DisplayName("Slugs containing slashes become nested directories")
        void slugWithSlash() {
            assertThat(mediaCacheService.ensure(HERO_URL, "education/admission-test", "hero"))
                    .contains("images/education/admission-test/hero.png");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A failed download leaves no file and the next call tries again")
        void failureLeavesNoFile() throws IOException {
            // when
            Optional<String> first = mediaCacheService.ensure(BROKEN_URL, "s2", "image_1");
            Optional<String> second = mediaCacheService.ensure(BROKEN_URL, "s2", "image_1");

            // then
            assertThat(first).isEmpty();
            assertThat(second).isEmpty();
            assertThat(fetcher.downloads(BROKEN_URL)).isEqualTo(2);
            try (Stream<Path> files = Files.list(dataRoot.resolve("images/s2"))) {
                assertThat(files).isEmpty();
            }
        }

        @Test
        @DisplayName("A blank URL is not requested")
        void blankUrl() {
            assertThat(mediaCacheService.ensure(" ", "s3", "hero")).isEmpty();
            assertThat(mediaCacheService.ensure(null, "s3", "hero")).isEmpty();
            assertThat(fetcher.totalDownloads()).isZero();
        }

        @Test
        @DisplayName("A slug escaping the images directory is refused")
        void pathTraversal() {
            assertThat(mediaCacheService.ensure(HERO_URL, "../../outside", "hero")).isEmpty();
            assertThat(fetcher.totalDownloads()).isZero();
        }
    }

    @Test
    @DisplayName("Body images are numbered in order and failures are omitted")
    void ensureAllNumbersImages() {
        // given
        fetcher.serve("https://media.example.com/a.jpg", "a");
        fetcher.serve("https://media.example.com/c.webp?w=640", "c");

        // when
        List<String> paths = mediaCacheService.ensureAll(List.of(
                "https://media.example.com/a.jpg",
                BROKEN_URL,
                "https://media.example.com/c.webp?w=640"), "s4", null);

        // then
        assertThat(paths).containsExactly("images/s4/image_1.jpg", "images/s4/image_3.webp");
    }

    @ParameterizedTest
    @CsvSource({
            "https://media.example.com/a/photo.png, .png",
            "https://media.example.com/a/photo.webp?w=640&q=80, .webp",
            "https://media.example.com/a/photo.JPEG#frag, .JPEG",
            "https://media.example.com/a/photo, .jpg",
            "https://media.example.com/a/photo., .jpg",
            "https://media.example.com/a/photo.original, .jpg",
            "https://media.example.com/a.b/photo, .jpg"
    })
    @DisplayName("Extension comes from the URL path, defaulting to .jpg")
    void extensionOf(String url, String expected) {
        assertThat(MediaCacheService.extensionOf(url)).isEqualTo(expected);
    }

    /**
     * Serves canned bodies and counts download requests per URL.
     */
    private static class CountingFetcher implements HttpFetcher {

        private final Map<String, String> bodies = new HashMap<>();
        private final Map<String, Integer> counts = new HashMap<>();
        private final List<String> failing = new ArrayList<>();

        void serve(String url, String body) {
            bodies.put(url, body);
        }

        void failAfterPartialWrite(String url) {
            failing.add(url);
        }

        int downloads(String url) {
            return counts.getOrDefault(url, 0);
        }

        int totalDownloads() {
            return counts.values().stream().mapToInt(Integer::intValue).sum();
        }

        @Override
        public FetchedPage fetch(String url, Map<String, String> headers) {
            throw new UnsupportedOperationException("pages are not served by this fake");
        }

        @Override
        public void download(String url, Path target) {
            counts.merge(url, 1, Integer::sum);
            try {
                if (failing.contains(url)) {
                    Files.writeString(target, "partial", StandardCharsets.UTF_8);
                    throw new TransportException("Connection reset", url);
                }
                String body = bodies.get(url);
                if (body == null) {
                    throw TransportException.httpStatus(url, 404);
                }
                Files.writeString(target, body, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}

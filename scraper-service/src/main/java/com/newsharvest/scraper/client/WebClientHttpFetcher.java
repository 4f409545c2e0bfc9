package com.newsharvest.scraper.client;

import com.newsharvest.scraper.config.ScraperProperties;
import com.newsharvest.scraper.exception.TransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class WebClientHttpFetcher implements HttpFetcher {

    private final WebClient webClient;
    private final ScraperProperties properties;

    @Override
    public FetchedPage fetch(String url, Map<String, String> headers) {
        try {
            log.debug("GET {}", url);
            FetchedPage page = webClient.get()
                    .uri(toUri(url))
                    .headers(h -> headers.forEach(h::set))
                    .exchangeToMono(response -> toPage(url, response))
                    .timeout(timeout())
                    .block();
            if (page == null) {
                throw TransportException.emptyBody(url);
            }
            return page;
        } catch (TransportException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransportException("Error fetching " + url + ": " + e.getMessage(), url, e);
        }
    }

    @Override
    public void download(String url, Path target) {
        try {
            Flux<DataBuffer> body = webClient.get()
                    .uri(toUri(url))
                    .exchangeToFlux(response -> {
                        if (!response.statusCode().is2xxSuccessful()) {
                            return response.releaseBody()
                                    .thenMany(Flux.error(TransportException.httpStatus(url, response.statusCode().value())));
                        }
                        return response.bodyToFlux(DataBuffer.class);
                    });
            DataBufferUtils.write(body, target,
                            StandardOpenOption.CREATE,
                            StandardOpenOption.TRUNCATE_EXISTING,
                            StandardOpenOption.WRITE)
                    .timeout(timeout())
                    .block();
        } catch (TransportException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransportException("Error downloading " + url + ": " + e.getMessage(), url, e);
        }
    }

    private Mono<FetchedPage> toPage(String url, ClientResponse response) {
        int status = response.statusCode().value();
        if (!response.statusCode().is2xxSuccessful()) {
            return response.releaseBody().then(Mono.error(TransportException.httpStatus(url, status)));
        }
        String contentType = response.headers().contentType()
                .map(MediaType::toString)
                .orElse(null);
        return response.bodyToMono(byte[].class)
                .defaultIfEmpty(new byte[0])
                .map(body -> new FetchedPage(url, status, contentType, body));
    }

    private Duration timeout() {
        return Duration.ofMillis(properties.getHttp().getReadTimeout());
    }

    private static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL is blank");
        }
        String trimmed = url.trim();
        try {
            return URI.create(trimmed);
        } catch (IllegalArgumentException e) {
            // raw characters such as spaces in media keys; percent-encode them
            return UriComponentsBuilder.fromHttpUrl(trimmed).encode().build().toUri();
        }
    }
}

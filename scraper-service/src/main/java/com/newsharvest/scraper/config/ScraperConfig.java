package com.newsharvest.scraper.config;

import com.newsharvest.scraper.service.detail.RequestThrottle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class ScraperConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Pause between detail requests; {@code scraper.delay=0s} disables it.
     */
    @Bean
    public RequestThrottle requestThrottle(ScraperProperties properties) {
        log.debug("Detail requests throttled to one every {}", properties.getDelay());
        return RequestThrottle.of(properties.getDelay());
    }
}

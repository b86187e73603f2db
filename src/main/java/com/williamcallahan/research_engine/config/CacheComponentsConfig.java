/**
 * Configuration class for cache-related components and beans
 * It handles:
 * - Per-DOI caches for Crossref verification and Unpaywall open-access lookups
 * - Sizing and expiry from app.cache.*
 *
 * @author William Callahan
 */
package com.williamcallahan.research_engine.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.research_engine.service.provider.CrossrefWork;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CacheComponentsConfig {

    @Bean
    public Cache<String, CrossrefWork> doiVerificationCache(AppConfigurationProperties appProperties) {
        return lookupCache(appProperties);
    }

    /**
     * Values are the resolved open-access URL, or an empty string when Unpaywall knows the DOI
     * but has no open copy.
     */
    @Bean
    public Cache<String, String> openAccessCache(AppConfigurationProperties appProperties) {
        return lookupCache(appProperties);
    }

    private static <V> Cache<String, V> lookupCache(AppConfigurationProperties appProperties) {
        AppConfigurationProperties.Cache settings = appProperties.getCache();
        return Caffeine.newBuilder()
                .maximumSize(settings.getLookupMaxSize())
                .expireAfterWrite(Duration.ofMinutes(settings.getLookupTtlMinutes()))
                .recordStats() // Enable statistics recording for metrics
                .build();
    }
}

/**
 * Main application configuration properties
 * Centralizes all app.* configuration properties for better type safety and IDE support
 *
 * @author William Callahan
 */

package com.williamcallahan.research_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppConfigurationProperties {

    @NestedConfigurationProperty
    private Aggregation aggregation = new Aggregation();

    @NestedConfigurationProperty
    private Events events = new Events();

    @NestedConfigurationProperty
    private Artifacts artifacts = new Artifacts();

    @NestedConfigurationProperty
    private Generation generation = new Generation();

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    // Getters and setters
    public Aggregation getAggregation() { return aggregation; }
    public void setAggregation(Aggregation aggregation) { this.aggregation = aggregation; }

    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }

    public Artifacts getArtifacts() { return artifacts; }
    public void setArtifacts(Artifacts artifacts) { this.artifacts = artifacts; }

    public Generation getGeneration() { return generation; }
    public void setGeneration(Generation generation) { this.generation = generation; }

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    // Nested configuration classes
    public static class Aggregation {
        private int verificationLimit = 15;
        private int rankingInputLimit = 15;
        private int rankingFallbackCount = 10;
        private int webCandidateLimit = 15;
        private int openAlexKeywordLimit = 5;
        private int semanticScholarKeywordLimit = 3;

        public int getVerificationLimit() { return verificationLimit; }
        public void setVerificationLimit(int verificationLimit) { this.verificationLimit = verificationLimit; }

        public int getRankingInputLimit() { return rankingInputLimit; }
        public void setRankingInputLimit(int rankingInputLimit) { this.rankingInputLimit = rankingInputLimit; }

        public int getRankingFallbackCount() { return rankingFallbackCount; }
        public void setRankingFallbackCount(int rankingFallbackCount) { this.rankingFallbackCount = rankingFallbackCount; }

        public int getWebCandidateLimit() { return webCandidateLimit; }
        public void setWebCandidateLimit(int webCandidateLimit) { this.webCandidateLimit = webCandidateLimit; }

        public int getOpenAlexKeywordLimit() { return openAlexKeywordLimit; }
        public void setOpenAlexKeywordLimit(int openAlexKeywordLimit) { this.openAlexKeywordLimit = openAlexKeywordLimit; }

        public int getSemanticScholarKeywordLimit() { return semanticScholarKeywordLimit; }
        public void setSemanticScholarKeywordLimit(int semanticScholarKeywordLimit) { this.semanticScholarKeywordLimit = semanticScholarKeywordLimit; }
    }

    public static class Events {
        private long heartbeatSeconds = 30;
        private long streamTimeoutMillis = 3_600_000L;
        private int queryTimeoutSeconds = 5;

        public long getHeartbeatSeconds() { return heartbeatSeconds; }
        public void setHeartbeatSeconds(long heartbeatSeconds) { this.heartbeatSeconds = heartbeatSeconds; }

        public long getStreamTimeoutMillis() { return streamTimeoutMillis; }
        public void setStreamTimeoutMillis(long streamTimeoutMillis) { this.streamTimeoutMillis = streamTimeoutMillis; }

        public int getQueryTimeoutSeconds() { return queryTimeoutSeconds; }
        public void setQueryTimeoutSeconds(int queryTimeoutSeconds) { this.queryTimeoutSeconds = queryTimeoutSeconds; }
    }

    public static class Artifacts {
        private int maxVersionAttempts = 5;
        private long conflictBackoffMillis = 25;

        public int getMaxVersionAttempts() { return maxVersionAttempts; }
        public void setMaxVersionAttempts(int maxVersionAttempts) { this.maxVersionAttempts = maxVersionAttempts; }

        public long getConflictBackoffMillis() { return conflictBackoffMillis; }
        public void setConflictBackoffMillis(long conflictBackoffMillis) { this.conflictBackoffMillis = conflictBackoffMillis; }
    }

    public static class Generation {
        private String baseUrl = "https://api.groq.com/openai/v1";
        private String apiKey = "";
        private String model = "llama-3.3-70b-versatile";
        private int maxTokens = 4096;
        private int timeoutSeconds = 120;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Cache {
        private long lookupTtlMinutes = 60;
        private long lookupMaxSize = 5000;

        public long getLookupTtlMinutes() { return lookupTtlMinutes; }
        public void setLookupTtlMinutes(long lookupTtlMinutes) { this.lookupTtlMinutes = lookupTtlMinutes; }

        public long getLookupMaxSize() { return lookupMaxSize; }
        public void setLookupMaxSize(long lookupMaxSize) { this.lookupMaxSize = lookupMaxSize; }
    }
}

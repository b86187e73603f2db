/**
 * Configuration properties for the external evidence providers
 * Binds providers.* (base URLs, credentials, polite-pool contact addresses, fetch budget)
 *
 * @author William Callahan
 */

package com.williamcallahan.research_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "providers")
public class ProviderConfigurationProperties {

    @NestedConfigurationProperty
    private Fetch fetch = new Fetch();

    @NestedConfigurationProperty
    private OpenAlex openAlex = new OpenAlex();

    @NestedConfigurationProperty
    private SemanticScholar semanticScholar = new SemanticScholar();

    @NestedConfigurationProperty
    private Crossref crossref = new Crossref();

    @NestedConfigurationProperty
    private Unpaywall unpaywall = new Unpaywall();

    @NestedConfigurationProperty
    private Tavily tavily = new Tavily();

    public Fetch getFetch() { return fetch; }
    public void setFetch(Fetch fetch) { this.fetch = fetch; }

    public OpenAlex getOpenAlex() { return openAlex; }
    public void setOpenAlex(OpenAlex openAlex) { this.openAlex = openAlex; }

    public SemanticScholar getSemanticScholar() { return semanticScholar; }
    public void setSemanticScholar(SemanticScholar semanticScholar) { this.semanticScholar = semanticScholar; }

    public Crossref getCrossref() { return crossref; }
    public void setCrossref(Crossref crossref) { this.crossref = crossref; }

    public Unpaywall getUnpaywall() { return unpaywall; }
    public void setUnpaywall(Unpaywall unpaywall) { this.unpaywall = unpaywall; }

    public Tavily getTavily() { return tavily; }
    public void setTavily(Tavily tavily) { this.tavily = tavily; }

    public static class Fetch {
        private int maxRetries = 2;
        private int connectTimeoutMillis = 5000;
        private int readTimeoutSeconds = 15;
        private int defaultRetryAfterSeconds = 2;
        private int backoffStepSeconds = 1;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public int getConnectTimeoutMillis() { return connectTimeoutMillis; }
        public void setConnectTimeoutMillis(int connectTimeoutMillis) { this.connectTimeoutMillis = connectTimeoutMillis; }

        public int getReadTimeoutSeconds() { return readTimeoutSeconds; }
        public void setReadTimeoutSeconds(int readTimeoutSeconds) { this.readTimeoutSeconds = readTimeoutSeconds; }

        public int getDefaultRetryAfterSeconds() { return defaultRetryAfterSeconds; }
        public void setDefaultRetryAfterSeconds(int defaultRetryAfterSeconds) { this.defaultRetryAfterSeconds = defaultRetryAfterSeconds; }

        public int getBackoffStepSeconds() { return backoffStepSeconds; }
        public void setBackoffStepSeconds(int backoffStepSeconds) { this.backoffStepSeconds = backoffStepSeconds; }
    }

    public static class OpenAlex {
        private String baseUrl = "https://api.openalex.org";
        private String mailto = "";
        private int resultsPerPage = 10;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getMailto() { return mailto; }
        public void setMailto(String mailto) { this.mailto = mailto; }

        public int getResultsPerPage() { return resultsPerPage; }
        public void setResultsPerPage(int resultsPerPage) { this.resultsPerPage = resultsPerPage; }
    }

    public static class SemanticScholar {
        private String baseUrl = "https://api.semanticscholar.org/graph/v1";
        private String apiKey = "";
        private int resultLimit = 10;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public int getResultLimit() { return resultLimit; }
        public void setResultLimit(int resultLimit) { this.resultLimit = resultLimit; }
    }

    public static class Crossref {
        private String baseUrl = "https://api.crossref.org";
        private String mailto = "";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getMailto() { return mailto; }
        public void setMailto(String mailto) { this.mailto = mailto; }
    }

    public static class Unpaywall {
        private String baseUrl = "https://api.unpaywall.org/v2";
        private String email = "";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getEmail() { return email; }
        public void setEmail(String email) { this.email = email; }
    }

    public static class Tavily {
        private String baseUrl = "https://api.tavily.com";
        private String apiKey = "";
        private int maxResults = 5;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public int getMaxResults() { return maxResults; }
        public void setMaxResults(int maxResults) { this.maxResults = maxResults; }
    }
}

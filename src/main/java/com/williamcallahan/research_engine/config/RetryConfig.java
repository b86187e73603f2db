/**
 * Configuration for retry mechanisms around storage writes
 *
 * @author William Callahan
 *
 * Features:
 * - Retries artifact inserts that lost a version race to a concurrent writer
 * - Short fixed backoff between attempts, sized from app.artifacts.*
 */

package com.williamcallahan.research_engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Map;

@Configuration
@EnableRetry
public class RetryConfig {

    /**
     * Creates the retry template used when writing a new artifact version
     * Only {@link DuplicateKeyException} is retried; every other failure surfaces immediately
     *
     * @return RetryTemplate for artifact version conflicts
     */
    @Bean("artifactVersionRetryTemplate")
    public RetryTemplate artifactVersionRetryTemplate(AppConfigurationProperties appProperties) {
        AppConfigurationProperties.Artifacts settings = appProperties.getArtifacts();
        RetryTemplate retryTemplate = new RetryTemplate();

        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(settings.getMaxVersionAttempts(),
            Map.<Class<? extends Throwable>, Boolean>of(DuplicateKeyException.class, true));
        retryTemplate.setRetryPolicy(retryPolicy);

        FixedBackOffPolicy backOffPolicy = new FixedBackOffPolicy();
        backOffPolicy.setBackOffPeriod(settings.getConflictBackoffMillis());
        retryTemplate.setBackOffPolicy(backOffPolicy);

        return retryTemplate;
    }
}

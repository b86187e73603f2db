/**
 * Versioned storage of step outputs
 *
 * @author William Callahan
 *
 * Features:
 * - Each write of a (run, step) becomes the next version, starting at 1, without gaps
 * - Older versions are kept; reads return the latest
 * - Version conflicts between concurrent writers are retried with the artifact retry template
 */

package com.williamcallahan.research_engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.research_engine.model.Artifact;
import com.williamcallahan.research_engine.repository.ArtifactRepository;
import com.williamcallahan.research_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
public class ArtifactStoreService {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactStoreService.class);

    private final ArtifactRepository artifactRepository;
    private final RetryTemplate retryTemplate;
    private final ObjectMapper objectMapper;

    public ArtifactStoreService(ArtifactRepository artifactRepository,
                                @Qualifier("artifactVersionRetryTemplate") RetryTemplate retryTemplate,
                                ObjectMapper objectMapper) {
        this.artifactRepository = artifactRepository;
        this.retryTemplate = retryTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Stores a new version of a step's output.
     *
     * @throws IllegalArgumentException when the step name is blank or the content is missing
     * @throws org.springframework.dao.DuplicateKeyException when every retry lost the version race
     */
    public Artifact put(String runId, String stepName, JsonNode content) {
        if (!ValidationUtils.hasText(stepName)) {
            throw new IllegalArgumentException("step_name is required");
        }
        if (content == null || content.isNull() || content.isMissingNode()) {
            throw new IllegalArgumentException("content is required");
        }
        String step = stepName.trim();
        Artifact artifact = retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                logger.debug("Retrying artifact write for run {} step {} after version conflict (attempt {})",
                    runId, step, context.getRetryCount() + 1);
            }
            return artifactRepository.insertNextVersion(runId, step, content, Instant.now());
        });
        logger.info("Stored artifact {} v{} for run {}", step, artifact.version(), runId);
        return artifact;
    }

    /**
     * Stores any serializable value, e.g. a result bundle, as a new version.
     */
    public Artifact putValue(String runId, String stepName, Object value) {
        return put(runId, stepName, objectMapper.valueToTree(value));
    }

    public Optional<Artifact> getLatest(String runId, String stepName) {
        return artifactRepository.findLatest(runId, stepName);
    }

    /**
     * @return latest artifact per step name, ordered by step name
     */
    public Map<String, Artifact> listLatest(String runId) {
        Map<String, Artifact> latest = new LinkedHashMap<>();
        for (Artifact artifact : artifactRepository.findLatestPerStep(runId)) {
            latest.put(artifact.stepName(), artifact);
        }
        return latest;
    }
}

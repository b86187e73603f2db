/**
 * Service for creating runs and moving them between steps and statuses
 *
 * @author William Callahan
 */

package com.williamcallahan.research_engine.service;

import com.williamcallahan.research_engine.model.Run;
import com.williamcallahan.research_engine.model.RunStatus;
import com.williamcallahan.research_engine.repository.RunRepository;
import com.williamcallahan.research_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Service
public class RunService {

    private static final Logger logger = LoggerFactory.getLogger(RunService.class);
    static final String INITIAL_STEP = "idea";

    private final RunRepository runRepository;

    public RunService(RunRepository runRepository) {
        this.runRepository = runRepository;
    }

    public Run create(String step) {
        Instant now = Instant.now();
        Run run = new Run(UUID.randomUUID().toString(),
            ValidationUtils.hasText(step) ? step.trim() : INITIAL_STEP,
            RunStatus.RUNNING, now, now);
        runRepository.save(run);
        logger.info("Created run {} at step {}", run.getId(), run.getStep());
        return run;
    }

    public Optional<Run> find(String runId) {
        return runRepository.findById(runId);
    }

    /**
     * @throws RunNotFoundException when no run has this id
     */
    public Run require(String runId) {
        return runRepository.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    /**
     * @param step new step, or {@code null} to keep the current one
     */
    public void updateStepAndStatus(String runId, String step, RunStatus status) {
        if (!runRepository.updateStepAndStatus(runId, step, status)) {
            logger.warn("Cannot move run {} to {}: run does not exist", runId, status.getWireValue());
            return;
        }
        logger.info("Run {} is now {}{}", runId, status.getWireValue(), step != null ? " at step " + step : "");
    }
}

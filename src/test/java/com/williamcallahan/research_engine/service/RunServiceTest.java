package com.williamcallahan.research_engine.service;

import com.williamcallahan.research_engine.model.Run;
import com.williamcallahan.research_engine.model.RunStatus;
import com.williamcallahan.research_engine.repository.InMemoryRunRepository;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunServiceTest {

    private final RunService runService = new RunService(new InMemoryRunRepository());

    @Test
    void createDefaultsToIdeaStepAndRunning() {
        Run run = runService.create(null);

        assertThat(run.getId()).isNotBlank();
        assertThat(run.getStep()).isEqualTo("idea");
        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(runService.require(run.getId()).getCreatedAt()).isEqualTo(run.getCreatedAt());
    }

    @Test
    void nullStepKeepsCurrentStep() {
        Run run = runService.create("outline");

        runService.updateStepAndStatus(run.getId(), null, RunStatus.FAILED);

        Run updated = runService.require(run.getId());
        assertThat(updated.getStep()).isEqualTo("outline");
        assertThat(updated.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(updated.getUpdatedAt()).isAfterOrEqualTo(run.getUpdatedAt());
    }

    @Test
    void unknownRunIsNotFound() {
        assertThat(runService.find("missing")).isEmpty();
        assertThatThrownBy(() -> runService.require("missing"))
            .isInstanceOf(RunNotFoundException.class)
            .hasMessageContaining("missing");

        runService.updateStepAndStatus("missing", "x", RunStatus.COMPLETED);
        assertThat(runService.find("missing")).isEmpty();
    }
}

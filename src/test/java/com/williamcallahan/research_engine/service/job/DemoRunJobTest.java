package com.williamcallahan.research_engine.service.job;

import com.williamcallahan.research_engine.repository.InMemoryArtifactRepository;
import com.williamcallahan.research_engine.repository.InMemoryRunEventRepository;
import com.williamcallahan.research_engine.service.ArtifactStoreService;
import com.williamcallahan.research_engine.service.events.RunEventService;
import com.williamcallahan.research_engine.service.events.RunSubscriberRegistry;
import com.williamcallahan.research_engine.testutil.ResearchFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.retry.support.RetryTemplate;

import static org.assertj.core.api.Assertions.assertThat;

class DemoRunJobTest {

    private RunEventService runEventService;
    private ArtifactStoreService artifactStoreService;

    @BeforeEach
    void setUp() {
        runEventService = new RunEventService(new InMemoryRunEventRepository(), new RunSubscriberRegistry(),
            ResearchFixtures.objectMapper());
        artifactStoreService = new ArtifactStoreService(new InMemoryArtifactRepository(), new RetryTemplate(),
            ResearchFixtures.objectMapper());
    }

    @Test
    void playsScriptThenStoresSampleArtifacts() {
        new DemoRunJob(runEventService, artifactStoreService, ResearchFixtures.objectMapper(), 0).run("demo-run");

        assertThat(runEventService.listEvents("demo-run")).hasSize(DemoRunJob.SCRIPT.size());
        assertThat(runEventService.listEvents("demo-run").get(0).sourceName()).isEqualTo("IdeaGenerator");
        assertThat(artifactStoreService.listLatest("demo-run")).containsOnlyKeys("idea", "topic_critic", "outline");
        assertThat(artifactStoreService.getLatest("demo-run", "outline")).get()
            .satisfies(outline -> assertThat(outline.content().path("sections")).hasSize(6));
        assertThat(artifactStoreService.getLatest("demo-run", "topic_critic")).get()
            .satisfies(critique -> assertThat(critique.content().path("score").asDouble()).isEqualTo(8.5));
    }

    @Test
    void interruptionAbandonsTheRun() {
        DemoRunJob job = new DemoRunJob(runEventService, artifactStoreService, ResearchFixtures.objectMapper(), 10_000);
        Thread.currentThread().interrupt();
        try {
            job.run("demo-run");
        } finally {
            assertThat(Thread.interrupted()).isTrue();
        }

        assertThat(runEventService.listEvents("demo-run")).hasSize(1);
        assertThat(artifactStoreService.listLatest("demo-run")).isEmpty();
    }
}

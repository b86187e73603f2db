package com.williamcallahan.research_engine.controller;

import com.williamcallahan.research_engine.monitoring.ApiRequestMonitor;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AdminControllerTest {

    private ApiRequestMonitor monitor;
    private CircuitBreakerRegistry registry;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        monitor = new ApiRequestMonitor(new SimpleMeterRegistry());
        registry = CircuitBreakerRegistry.ofDefaults();
        mockMvc = MockMvcBuilders.standaloneSetup(new AdminController(monitor, registry)).build();
    }

    @Test
    void providerMetricsReflectRecordedRequests() throws Exception {
        monitor.recordSuccessfulRequest("openalex/works");
        monitor.recordFailedRequest("tavily/search", "HTTP 500");

        mockMvc.perform(get("/admin/providers/metrics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_requests").value(2))
            .andExpect(jsonPath("$.endpoints['openalex/works']").value(1))
            .andExpect(jsonPath("$.last_error").value("tavily/search: HTTP 500"));
    }

    @Test
    void circuitBreakerStatusListsBreakersByName() throws Exception {
        registry.circuitBreaker("tavily");
        registry.circuitBreaker("crossref").transitionToOpenState();

        String body = mockMvc.perform(get("/admin/circuit-breakers/status"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();

        assertThat(body.lines()).hasSize(2);
        assertThat(body.lines().findFirst()).hasValueSatisfying(line -> assertThat(line).startsWith("crossref: OPEN"));
    }

    @Test
    void resetClosesBreaker() throws Exception {
        CircuitBreaker crossref = registry.circuitBreaker("crossref");
        crossref.transitionToOpenState();

        mockMvc.perform(post("/admin/circuit-breakers/crossref/reset"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("CLOSED"));
        assertThat(crossref.getState()).isEqualTo(CircuitBreaker.State.CLOSED);

        mockMvc.perform(post("/admin/circuit-breakers/unknown/reset"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Circuit breaker not found"));
    }

    @Test
    void emptyRegistryHasStatusMessage() throws Exception {
        mockMvc.perform(get("/admin/circuit-breakers/status"))
            .andExpect(content().string("No circuit breakers registered.\n"));
    }
}

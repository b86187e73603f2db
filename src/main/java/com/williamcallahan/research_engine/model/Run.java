/**
 * A long-running background job and its current step and status
 */
package com.williamcallahan.research_engine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Run {
    private String id;
    private String step;
    private RunStatus status;
    private Instant createdAt;
    private Instant updatedAt;
}

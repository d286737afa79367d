package com.droidassist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A reply text set through the API, keyed by scenario name.
 */
@Entity
@Table(name = "scenario_responses")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScenarioResponse {

    @Id
    @Column(length = 64)
    private String name;

    @Column(name = "response_text", nullable = false, columnDefinition = "TEXT")
    private String text;

    @Column(name = "updated_at")
    private Instant updatedAt;
}

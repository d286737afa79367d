package com.droidassist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Answer-mode settings that survive a restart. A single row.
 */
@Entity
@Table(name = "monitor_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonitorSettings {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "current_scenario", nullable = false)
    private String currentScenario;

    /** Reply at once with the current scenario; otherwise reply busy after the ring delay */
    @Column(name = "auto_answer")
    private boolean autoAnswer;

    /** Whether polling was on when last changed, resumed at startup */
    @Column(name = "monitoring")
    private boolean monitoring;

    @Column(name = "ring_delay_seconds")
    private int ringDelaySeconds;

    @Column(name = "updated_at")
    private Instant updatedAt;
}

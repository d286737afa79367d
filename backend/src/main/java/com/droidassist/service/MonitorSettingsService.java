package com.droidassist.service;

import com.droidassist.entity.MonitorSettings;
import com.droidassist.repository.MonitorSettingsRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Holds the answer-mode settings in memory and writes every change through to storage.
 *
 * Reads never touch the database. A storage failure on load falls back to the
 * configured defaults; on save it is logged and the in-memory value still applies.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonitorSettingsService {

    public static final int MAX_RING_DELAY_SECONDS = 60;

    private final MonitorSettingsRepository monitorSettingsRepository;
    private final Clock clock;

    @Value("${droidassist.scenario.current:busy}")
    private String defaultScenario = "busy";

    @Value("${droidassist.monitor.auto-answer:true}")
    private boolean defaultAutoAnswer = true;

    @Value("${droidassist.monitor.ring-delay-seconds:10}")
    private int defaultRingDelaySeconds = 10;

    private volatile String currentScenario;
    private volatile boolean autoAnswer;
    private volatile boolean monitoring;
    private volatile int ringDelaySeconds;

    @PostConstruct
    public void load() {
        currentScenario = defaultScenario;
        autoAnswer = defaultAutoAnswer;
        monitoring = false;
        ringDelaySeconds = clampRingDelay(defaultRingDelaySeconds);
        try {
            monitorSettingsRepository.findById(MonitorSettings.SINGLETON_ID).ifPresentOrElse(stored -> {
                currentScenario = stored.getCurrentScenario();
                autoAnswer = stored.isAutoAnswer();
                monitoring = stored.isMonitoring();
                ringDelaySeconds = clampRingDelay(stored.getRingDelaySeconds());
                log.info("Monitor settings loaded: scenario={} autoAnswer={} monitoring={} ringDelay={}s",
                    currentScenario, autoAnswer, monitoring, ringDelaySeconds);
            }, () -> log.info("No stored monitor settings, using defaults (scenario={} autoAnswer={} ringDelay={}s)",
                currentScenario, autoAnswer, ringDelaySeconds));
        } catch (Exception e) {
            log.error("Failed to load monitor settings, using defaults: {}", e.getMessage(), e);
        }
    }

    public String getCurrentScenario() {
        return currentScenario;
    }

    public boolean isAutoAnswer() {
        return autoAnswer;
    }

    public boolean isMonitoring() {
        return monitoring;
    }

    public int getRingDelaySeconds() {
        return ringDelaySeconds;
    }

    public Duration getRingDelay() {
        return Duration.ofSeconds(ringDelaySeconds);
    }

    public synchronized void setCurrentScenario(String scenario) {
        currentScenario = scenario;
        save();
    }

    public synchronized void setAutoAnswer(boolean enabled) {
        autoAnswer = enabled;
        save();
        log.info("Auto-answer {}", enabled ? "enabled" : "disabled, replying busy after the ring delay");
    }

    public synchronized void setMonitoring(boolean enabled) {
        monitoring = enabled;
        save();
    }

    public synchronized void setRingDelaySeconds(int seconds) {
        if (seconds < 0 || seconds > MAX_RING_DELAY_SECONDS) {
            throw new IllegalArgumentException(
                "Ring delay must be between 0 and " + MAX_RING_DELAY_SECONDS + " seconds: " + seconds);
        }
        ringDelaySeconds = seconds;
        save();
        log.info("Ring delay set to {}s", seconds);
    }

    private void save() {
        try {
            monitorSettingsRepository.save(MonitorSettings.builder()
                .id(MonitorSettings.SINGLETON_ID)
                .currentScenario(currentScenario)
                .autoAnswer(autoAnswer)
                .monitoring(monitoring)
                .ringDelaySeconds(ringDelaySeconds)
                .updatedAt(clock.instant())
                .build());
        } catch (Exception e) {
            log.error("Failed to save monitor settings: {}", e.getMessage(), e);
        }
    }

    private static int clampRingDelay(int seconds) {
        return Math.max(0, Math.min(seconds, MAX_RING_DELAY_SECONDS));
    }
}

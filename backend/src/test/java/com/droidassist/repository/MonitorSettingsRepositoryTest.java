package com.droidassist.repository;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.util.ReflectionTestUtils;

import com.droidassist.entity.MonitorSettings;
import com.droidassist.service.MonitorSettingsService;
import com.droidassist.service.ScenarioService;

/**
 * Settings and reply texts written by one service instance are read back by a
 * fresh one, as after an application restart.
 */
@DataJpaTest
@DisplayName("MonitorSettingsRepository Tests")
class MonitorSettingsRepositoryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);

    @Autowired
    private MonitorSettingsRepository monitorSettingsRepository;

    @Autowired
    private ScenarioResponseRepository scenarioResponseRepository;

    private MonitorSettingsService startSettings() {
        MonitorSettingsService settings = new MonitorSettingsService(monitorSettingsRepository, CLOCK);
        ReflectionTestUtils.setField(settings, "defaultScenario", "busy");
        ReflectionTestUtils.setField(settings, "defaultAutoAnswer", true);
        ReflectionTestUtils.setField(settings, "defaultRingDelaySeconds", 10);
        settings.load();
        return settings;
    }

    private ScenarioService startScenarios(MonitorSettingsService settings) {
        ScenarioService scenarios = new ScenarioService(scenarioResponseRepository, settings, CLOCK);
        scenarios.loadStoredResponses();
        return scenarios;
    }

    @Test
    @DisplayName("Should keep a single settings row however often it is saved")
    void shouldKeepSingleRow() {
        MonitorSettingsService settings = startSettings();

        settings.setAutoAnswer(false);
        settings.setRingDelaySeconds(20);
        settings.setMonitoring(true);

        assertEquals(1, monitorSettingsRepository.count());
        MonitorSettings stored = monitorSettingsRepository.findById(MonitorSettings.SINGLETON_ID).orElseThrow();
        assertFalse(stored.isAutoAnswer());
        assertEquals(20, stored.getRingDelaySeconds());
        assertTrue(stored.isMonitoring());
    }

    @Test
    @DisplayName("Should restore the answer mode, scenario and custom texts after a restart")
    void shouldRestoreAfterRestart() {
        MonitorSettingsService settings = startSettings();
        ScenarioService scenarios = startScenarios(settings);
        scenarios.setResponse("gym", "我在健身，稍后回电。");
        scenarios.setResponse("busy", "稍后再打。");
        scenarios.selectScenario("gym");
        settings.setAutoAnswer(false);
        settings.setRingDelaySeconds(15);

        MonitorSettingsService restartedSettings = startSettings();
        ScenarioService restartedScenarios = startScenarios(restartedSettings);

        assertEquals("gym", restartedScenarios.getCurrentScenario());
        assertEquals("我在健身，稍后回电。", restartedScenarios.getCurrentResponse());
        assertEquals("稍后再打。", restartedScenarios.getResponse("busy"));
        assertFalse(restartedSettings.isAutoAnswer());
        assertEquals(15, restartedSettings.getRingDelaySeconds());
    }
}

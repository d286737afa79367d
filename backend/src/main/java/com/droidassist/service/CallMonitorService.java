package com.droidassist.service;

import com.droidassist.call.CallEvent;
import com.droidassist.call.CallMonitorLoop;
import com.droidassist.dto.CallMonitorDTO;
import com.droidassist.dto.CallRecordDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Starts and stops call monitoring, switches the answer mode and reports status.
 *
 * Monitoring that was on at shutdown is resumed at startup.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CallMonitorService {

    private final CallMonitorLoop callMonitorLoop;
    private final ScenarioService scenarioService;
    private final MonitorSettingsService monitorSettingsService;
    private final CallRecordService callRecordService;
    private final CallEventPublisher callEventPublisher;

    @Value("${droidassist.monitor.auto-start:false}")
    private boolean autoStart;

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (autoStart) {
            log.info("Auto-start enabled, starting call monitor");
            callMonitorLoop.start();
        } else if (monitorSettingsService.isMonitoring()) {
            log.info("Call monitor was running before shutdown, resuming");
            callMonitorLoop.start();
        }
    }

    public CallMonitorDTO.Status enable() {
        if (!callMonitorLoop.start()) {
            log.debug("Call monitor already running");
        }
        monitorSettingsService.setMonitoring(true);
        return getStatus();
    }

    public CallMonitorDTO.Status disable() {
        if (!callMonitorLoop.stop()) {
            log.debug("Call monitor already stopped");
        }
        monitorSettingsService.setMonitoring(false);
        return getStatus();
    }

    public CallMonitorDTO.Status setAutoAnswer(boolean enabled) {
        monitorSettingsService.setAutoAnswer(enabled);
        return getStatus();
    }

    /**
     * @throws IllegalArgumentException when outside 0 to {@value MonitorSettingsService#MAX_RING_DELAY_SECONDS}
     */
    public CallMonitorDTO.Status setRingDelay(int seconds) {
        monitorSettingsService.setRingDelaySeconds(seconds);
        return getStatus();
    }

    public CallMonitorDTO.Status getStatus() {
        CallRecordDTO.Stats stats = callRecordService.stats();
        CallEvent lastEvent = callMonitorLoop.getLastEvent();
        return CallMonitorDTO.Status.builder()
            .running(callMonitorLoop.isRunning())
            .lastState(callMonitorLoop.getLastState())
            .lastEvent(lastEvent != null ? callEventPublisher.toMessage(lastEvent) : null)
            .autoAnswer(monitorSettingsService.isAutoAnswer())
            .ringDelaySeconds(monitorSettingsService.getRingDelaySeconds())
            .currentScenario(scenarioService.getCurrentScenario())
            .availableScenarios(scenarioService.getScenarioNames())
            .pollIntervalMillis(callMonitorLoop.getPollInterval().toMillis())
            .cooldownMillis(callMonitorLoop.getCooldown().toMillis())
            .dispatchCount(callMonitorLoop.getDispatchCount())
            .missedRingCount(callMonitorLoop.getMissedRingCount())
            .totalCalls(stats.getTotalCalls())
            .recentCalls24h(stats.getRecentCalls24h())
            .build();
    }
}

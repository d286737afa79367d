package com.droidassist.call;

import com.droidassist.bridge.DeviceBridge;
import com.droidassist.entity.CallRecord;
import com.droidassist.service.CallRecordService;
import com.droidassist.service.MonitorSettingsService;
import com.droidassist.service.ScenarioService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Answers the ringing call, speaks the current scenario's reply and hangs up.
 *
 * With auto-answer off the call is left to ring for the configured delay and,
 * if it is still ringing then, answered with the {@value #DELAYED_SCENARIO} reply.
 *
 * Steps run in a fixed order, each with its own timeout. A failed step is
 * logged and the sequence carries on; hang-up always runs last so the line is
 * never left off-hook. Every run appends exactly one {@link CallRecord}.
 * Concurrent runs are prevented by the caller's cooldown, not here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponseSequencer {

    public static final String DELAYED_SCENARIO = "busy";

    private final DeviceBridge bridge;
    private final StateSampler sampler;
    private final ScenarioService scenarioService;
    private final MonitorSettingsService monitorSettingsService;
    private final CallRecordService callRecordService;
    private final Ticker ticker;
    private final Clock clock;

    @Value("${droidassist.sequencer.step-timeout-ms:5000}")
    private long stepTimeoutMs;

    @Value("${droidassist.sequencer.settle-delay-ms:1000}")
    private long settleDelayMs;

    @Value("${droidassist.sequencer.wait-per-char-ms:150}")
    private long waitPerCharMs;

    @Value("${droidassist.sequencer.min-wait-ms:3000}")
    private long minWaitMs;

    @Value("${droidassist.sequencer.max-wait-ms:20000}")
    private long maxWaitMs;

    @FunctionalInterface
    private interface Step {
        void run();
    }

    /**
     * Handles one incoming call in the current answer mode. Empty when the delayed
     * reply was skipped because the call stopped ringing first.
     */
    public Optional<CallRecord> onIncomingCall() {
        if (monitorSettingsService.isAutoAnswer()) {
            return Optional.of(respond());
        }
        Duration delay = monitorSettingsService.getRingDelay();
        log.info("Auto-answer off, replying '{}' if still ringing after {}s", DELAYED_SCENARIO, delay.toSeconds());
        if (!pause(delay)) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        CallState state = sampler.sample();
        if (state != CallState.RINGING) {
            log.info("Call no longer ringing ({}), delayed reply skipped", state);
            return Optional.empty();
        }
        return Optional.of(respond(DELAYED_SCENARIO));
    }

    public CallRecord respond() {
        return respond(scenarioService.getCurrentScenario());
    }

    CallRecord respond(String scenario) {
        long started = ticker.read();
        String responseText = scenarioService.getResponse(scenario);
        CallerInfo caller = resolveCaller();
        log.info("Auto-answering call from {} with scenario '{}'", caller.getPhoneNumber(), scenario);

        boolean answered = false;
        boolean spoke = false;
        boolean hungUp;
        boolean interrupted = false;
        try {
            answered = runStep("answer", () -> bridge.answerCall(stepTimeout()));
            interrupted = !pause(settleDelayMs);
            if (!interrupted) {
                spoke = runStep("speak", () -> bridge.speak(responseText, stepTimeout()));
                interrupted = !pause(speakingTime(responseText));
            }
        } finally {
            hungUp = runStep("hang-up", () -> bridge.hangUp(stepTimeout()));
        }

        double durationSeconds = (ticker.read() - started) / 1_000_000_000.0;
        CallRecord record = CallRecord.builder()
            .phoneNumber(caller.getPhoneNumber())
            .callerName(caller.getCallerName())
            .scenario(scenario)
            .responseText(responseText)
            .durationSeconds(durationSeconds)
            .autoAnswered(answered)
            .outcome(answered && spoke && hungUp ? CallRecord.Outcome.COMPLETED : CallRecord.Outcome.PARTIAL)
            .timestamp(clock.instant())
            .build();
        callRecordService.append(record);

        log.info("Auto-answer finished for {} in {}s ({})",
            caller.getPhoneNumber(), String.format("%.1f", durationSeconds), record.getOutcome());
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return record;
    }

    /**
     * Time to let the reply play: proportional to its length, within [min, max].
     */
    Duration speakingTime(String text) {
        long proportional = (long) text.length() * waitPerCharMs;
        return Duration.ofMillis(Math.min(Math.max(proportional, minWaitMs), maxWaitMs));
    }

    private CallerInfo resolveCaller() {
        try {
            return CallerInfo.fromRegistryDump(bridge.readTelephonyRegistry(stepTimeout()));
        } catch (Exception e) {
            log.warn("Could not read caller number: {}", e.getMessage());
            return CallerInfo.unknown();
        }
    }

    private boolean runStep(String name, Step step) {
        try {
            step.run();
            log.debug("Step '{}' done", name);
            return true;
        } catch (Exception e) {
            log.warn("Step '{}' failed: {}", name, e.getMessage());
            return false;
        }
    }

    private boolean pause(long millis) {
        return pause(Duration.ofMillis(millis));
    }

    private boolean pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting {} ms", duration.toMillis());
            return false;
        }
    }

    private Duration stepTimeout() {
        return Duration.ofMillis(stepTimeoutMs);
    }
}

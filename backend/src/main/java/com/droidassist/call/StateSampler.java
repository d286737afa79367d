package com.droidassist.call;

import com.droidassist.bridge.DeviceBridge;
import com.droidassist.bridge.DeviceBridgeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One bounded poll of the device call state.
 *
 * Sources are tried from most to least structured: the telephony registry
 * dump, the voice call state property, then the audio mode. The first source
 * that classifies unambiguously wins. A source whose command fails outright is
 * skipped like an inconclusive one. The whole poll shares one time budget; a
 * timed out command or an exhausted budget yields {@link CallState#UNKNOWN}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StateSampler {

    private static final Pattern REGISTRY_CALL_STATE = Pattern.compile("mCallState=(\\d+)");
    private static final Pattern AUDIO_MODE = Pattern.compile("(?i)mode\\s*[:=]\\s*(MODE_[A-Z_]+)");

    private final DeviceBridge bridge;
    private final Ticker ticker;

    @Value("${droidassist.monitor.sample-timeout-ms:800}")
    private long sampleTimeoutMs;

    public CallState sample() {
        long deadline = ticker.read() + Duration.ofMillis(sampleTimeoutMs).toNanos();
        try {
            Optional<CallState> state = query(deadline, bridge::readTelephonyRegistry, StateSampler::classifyRegistry);
            if (state.isEmpty()) {
                state = query(deadline, bridge::readCallStateProperty, StateSampler::classifyProperty);
            }
            if (state.isEmpty()) {
                state = query(deadline, bridge::readAudioState, StateSampler::classifyAudio);
            }
            return state.orElse(CallState.UNKNOWN);
        } catch (BudgetExhaustedException e) {
            log.debug("Call state poll ran out of its {} ms budget", sampleTimeoutMs);
            return CallState.UNKNOWN;
        } catch (DeviceBridgeException e) {
            log.debug("Call state poll timed out: {}", e.getMessage());
            return CallState.UNKNOWN;
        } catch (Exception e) {
            log.warn("Call state poll failed: {}", e.getMessage());
            return CallState.UNKNOWN;
        }
    }

    private Optional<CallState> query(long deadline, Function<Duration, String> source,
                                      Function<String, Optional<CallState>> classifier) {
        long remaining = deadline - ticker.read();
        if (remaining <= 0) {
            throw new BudgetExhaustedException();
        }
        String output;
        try {
            output = source.apply(Duration.ofNanos(remaining));
        } catch (DeviceBridgeException e) {
            if (e.isTimedOut()) {
                throw e;
            }
            log.debug("Call state source failed, trying the next one: {}", e.getMessage());
            return Optional.empty();
        }
        return classifier.apply(output);
    }

    /**
     * mCallState codes, one per subscription: 0 idle, 1 ringing, 2 off-hook.
     * Any ringing subscription wins, then any off-hook one; an unrecognised code is ambiguous.
     */
    static Optional<CallState> classifyRegistry(String dump) {
        if (dump == null) {
            return Optional.empty();
        }
        Set<String> codes = new HashSet<>();
        Matcher m = REGISTRY_CALL_STATE.matcher(dump);
        while (m.find()) {
            codes.add(m.group(1));
        }
        return classifyCodes(codes);
    }

    /**
     * gsm.voice.call.state, comma separated on multi-SIM devices.
     */
    static Optional<CallState> classifyProperty(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        Set<String> codes = new HashSet<>();
        for (String part : value.strip().split(",")) {
            codes.add(part.strip());
        }
        return classifyCodes(codes);
    }

    static Optional<CallState> classifyAudio(String dump) {
        if (dump == null || dump.isBlank()) {
            return Optional.empty();
        }
        Matcher m = AUDIO_MODE.matcher(dump);
        if (m.find()) {
            return fromAudioMode(m.group(1).toUpperCase(Locale.ROOT));
        }
        if (dump.contains("MODE_IN_CALL")) {
            return Optional.of(CallState.ANSWERED);
        }
        if (dump.contains("MODE_RINGTONE")) {
            return Optional.of(CallState.RINGING);
        }
        return Optional.empty();
    }

    private static Optional<CallState> fromAudioMode(String mode) {
        return switch (mode) {
            case "MODE_NORMAL" -> Optional.of(CallState.IDLE);
            case "MODE_RINGTONE" -> Optional.of(CallState.RINGING);
            case "MODE_IN_CALL", "MODE_IN_COMMUNICATION" -> Optional.of(CallState.ANSWERED);
            default -> Optional.empty();
        };
    }

    private static Optional<CallState> classifyCodes(Set<String> codes) {
        if (codes.isEmpty() || !Set.of("0", "1", "2").containsAll(codes)) {
            return Optional.empty();
        }
        if (codes.contains("1")) {
            return Optional.of(CallState.RINGING);
        }
        if (codes.contains("2")) {
            return Optional.of(CallState.ACTIVE);
        }
        return Optional.of(CallState.IDLE);
    }

    private static class BudgetExhaustedException extends RuntimeException {
        BudgetExhaustedException() {
            super(null, null, false, false);
        }
    }
}

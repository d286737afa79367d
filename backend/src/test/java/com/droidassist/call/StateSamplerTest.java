package com.droidassist.call;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import com.droidassist.bridge.DeviceBridge;
import com.droidassist.bridge.DeviceBridgeException;

/**
 * Unit tests for StateSampler
 *
 * Covers the registry, property and audio tiers, falling through
 * failed sources, and the shared time budget.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("StateSampler Tests")
class StateSamplerTest {

    @Mock
    private DeviceBridge bridge;

    private final AtomicLong now = new AtomicLong();

    private StateSampler sampler;

    @BeforeEach
    void setUp() {
        sampler = new StateSampler(bridge, now::get);
        ReflectionTestUtils.setField(sampler, "sampleTimeoutMs", 800L);
    }

    @Nested
    @DisplayName("sample() Method Tests")
    class SampleTests {

        @Test
        @DisplayName("Should classify from the telephony registry when it is unambiguous")
        void shouldUseRegistryFirst() {
            when(bridge.readTelephonyRegistry(any())).thenReturn("mCallState=1\nmCallIncomingNumber=13800138000");

            assertEquals(CallState.RINGING, sampler.sample());
            verify(bridge, never()).readCallStateProperty(any());
        }

        @Test
        @DisplayName("Should report any off-hook subscription as active")
        void shouldReportOffHookAsActive() {
            when(bridge.readTelephonyRegistry(any())).thenReturn("mCallState=0\nmCallState=2");

            assertEquals(CallState.ACTIVE, sampler.sample());
        }

        @Test
        @DisplayName("Should fall back to the call state property")
        void shouldFallBackToProperty() {
            when(bridge.readTelephonyRegistry(any())).thenReturn("no call state here");
            when(bridge.readCallStateProperty(any())).thenReturn("0,1\n");

            assertEquals(CallState.RINGING, sampler.sample());
            verify(bridge, never()).readAudioState(any());
        }

        @Test
        @DisplayName("Should fall back to the audio mode last")
        void shouldFallBackToAudioMode() {
            when(bridge.readTelephonyRegistry(any())).thenReturn("");
            when(bridge.readCallStateProperty(any())).thenReturn("");
            when(bridge.readAudioState(any())).thenReturn("Audio mode:\n  mode: MODE_IN_CALL\n");

            assertEquals(CallState.ANSWERED, sampler.sample());
        }

        @Test
        @DisplayName("Should return UNKNOWN when no source is conclusive")
        void shouldReturnUnknownWhenInconclusive() {
            when(bridge.readTelephonyRegistry(any())).thenReturn("mCallState=9");
            when(bridge.readCallStateProperty(any())).thenReturn("");
            when(bridge.readAudioState(any())).thenReturn("nothing useful");

            assertEquals(CallState.UNKNOWN, sampler.sample());
        }

        @Test
        @DisplayName("Should fall back to the property when the registry command fails")
        void shouldFallBackWhenRegistryFails() {
            when(bridge.readTelephonyRegistry(any())).thenThrow(new DeviceBridgeException(
                "adb shell dumpsys telephony.registry", "Exited with code 1: Permission Denial"));
            when(bridge.readCallStateProperty(any())).thenReturn("1");

            assertEquals(CallState.RINGING, sampler.sample());
            verify(bridge, never()).readAudioState(any());
        }

        @Test
        @DisplayName("Should return UNKNOWN when every source fails")
        void shouldReturnUnknownWhenEverySourceFails() {
            DeviceBridgeException offline = new DeviceBridgeException("adb shell", "device offline");
            when(bridge.readTelephonyRegistry(any())).thenThrow(offline);
            when(bridge.readCallStateProperty(any())).thenThrow(offline);
            when(bridge.readAudioState(any())).thenThrow(offline);

            assertEquals(CallState.UNKNOWN, assertDoesNotThrow(() -> sampler.sample()));
        }

        @Test
        @DisplayName("Should stop at the first timed out source")
        void shouldStopAtTimeout() {
            when(bridge.readTelephonyRegistry(any())).thenThrow(
                DeviceBridgeException.timeout("adb shell dumpsys telephony.registry", Duration.ofMillis(800)));

            assertEquals(CallState.UNKNOWN, sampler.sample());
            verify(bridge, never()).readCallStateProperty(any());
        }

        @Test
        @DisplayName("Should skip the remaining sources once the budget is spent")
        void shouldSkipSourcesAfterBudgetIsSpent() {
            when(bridge.readTelephonyRegistry(any())).thenAnswer(invocation -> {
                now.addAndGet(TimeUnit.MILLISECONDS.toNanos(801));
                return "nothing conclusive";
            });

            assertEquals(CallState.UNKNOWN, sampler.sample());
            verify(bridge, never()).readCallStateProperty(any());
        }

        @Test
        @DisplayName("Should hand each source only the budget left")
        void shouldPassRemainingBudget() {
            when(bridge.readTelephonyRegistry(any())).thenAnswer(invocation -> {
                now.addAndGet(TimeUnit.MILLISECONDS.toNanos(300));
                return "";
            });
            when(bridge.readCallStateProperty(Duration.ofMillis(500))).thenReturn("0");

            assertEquals(CallState.IDLE, sampler.sample());
        }

        @Test
        @DisplayName("Should return UNKNOWN without calling the bridge when the budget is zero")
        void shouldReturnUnknownWithoutBudget() {
            ReflectionTestUtils.setField(sampler, "sampleTimeoutMs", 0L);

            assertEquals(CallState.UNKNOWN, sampler.sample());
            verifyNoInteractions(bridge);
        }
    }

    @Nested
    @DisplayName("Classifier Tests")
    class ClassifierTests {

        @Test
        @DisplayName("Should treat unknown registry codes as ambiguous")
        void shouldTreatUnknownCodesAsAmbiguous() {
            assertEquals(Optional.empty(), StateSampler.classifyRegistry("mCallState=0\nmCallState=5"));
            assertEquals(Optional.of(CallState.IDLE), StateSampler.classifyRegistry("mCallState=0\nmCallState=0"));
        }

        @Test
        @DisplayName("Should prefer ringing over off-hook across subscriptions")
        void shouldPreferRinging() {
            assertEquals(Optional.of(CallState.RINGING), StateSampler.classifyProperty("2,1"));
        }

        @Test
        @DisplayName("Should map audio modes")
        void shouldMapAudioModes() {
            assertEquals(Optional.of(CallState.IDLE), StateSampler.classifyAudio("mode: MODE_NORMAL"));
            assertEquals(Optional.of(CallState.RINGING), StateSampler.classifyAudio("Mode = mode_ringtone"));
            assertEquals(Optional.of(CallState.ANSWERED), StateSampler.classifyAudio("mode=MODE_IN_COMMUNICATION"));
            assertEquals(Optional.empty(), StateSampler.classifyAudio("mode: MODE_CALL_SCREENING"));
        }
    }
}

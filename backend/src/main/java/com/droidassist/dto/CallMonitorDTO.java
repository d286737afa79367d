package com.droidassist.dto;

import com.droidassist.call.CallState;
import lombok.*;

import java.time.Instant;
import java.util.List;

public class CallMonitorDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Status {
        private boolean running;
        private CallState lastState;
        private EventMessage lastEvent;
        private boolean autoAnswer;
        private int ringDelaySeconds;
        private String currentScenario;
        private List<String> availableScenarios;
        private long pollIntervalMillis;
        private long cooldownMillis;
        private long dispatchCount;
        private long missedRingCount;
        private long totalCalls;
        private long recentCalls24h;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EventMessage {
        private CallState fromState;
        private CallState toState;
        private long timestampNanos;
        private boolean risingEdge;
        private Instant observedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScenarioRequest {
        private String scenario;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResponseTextRequest {
        private String text;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AutoAnswerRequest {
        private Boolean enabled;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RingDelayRequest {
        private Integer seconds;
    }
}

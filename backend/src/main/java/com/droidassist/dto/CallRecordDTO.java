package com.droidassist.dto;

import com.droidassist.entity.CallRecord;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

public class CallRecordDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private UUID id;
        private String phoneNumber;
        private String callerName;
        private String scenario;
        private String responseText;
        private double durationSeconds;
        private boolean autoAnswered;
        private CallRecord.Outcome outcome;
        private Instant timestamp;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stats {
        private long totalCalls;
        private long recentCalls24h;
    }
}

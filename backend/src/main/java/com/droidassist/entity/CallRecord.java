package com.droidassist.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * One handled incoming call. Written once when a response sequence ends, never updated.
 */
@Entity
@Immutable
@Table(name = "call_records", indexes = {
    @Index(name = "idx_call_record_timestamp", columnList = "timestamp")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class CallRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "phone_number", nullable = false)
    private String phoneNumber;

    @Column(name = "caller_name")
    private String callerName;

    @Column(nullable = false)
    private String scenario;

    @Column(name = "response_text", columnDefinition = "TEXT")
    private String responseText;

    @Column(name = "duration_seconds")
    private double durationSeconds;

    @Column(name = "auto_answered")
    private boolean autoAnswered;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Outcome outcome;

    @Column(nullable = false)
    private Instant timestamp;

    public enum Outcome {
        /** Every step succeeded */
        COMPLETED,
        /** At least one step failed; hang-up was still attempted */
        PARTIAL
    }
}

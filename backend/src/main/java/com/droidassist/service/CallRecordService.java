package com.droidassist.service;

import com.droidassist.dto.CallRecordDTO;
import com.droidassist.entity.CallRecord;
import com.droidassist.repository.CallRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Single writer of the call log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CallRecordService {

    static final int MAX_LIMIT = 500;

    private final CallRecordRepository callRecordRepository;
    private final Clock clock;

    /**
     * Appends a record. A storage failure is logged and never reaches the caller,
     * so a call in progress is not affected by the log.
     *
     * Runs in the repository's own transaction so a failed commit surfaces here.
     */
    public void append(CallRecord record) {
        try {
            callRecordRepository.save(record);
            log.info("Call record appended: {} scenario={} outcome={} duration={}s",
                record.getPhoneNumber(), record.getScenario(), record.getOutcome(),
                String.format("%.1f", record.getDurationSeconds()));
        } catch (Exception e) {
            log.error("Failed to append call record for {}: {}", record.getPhoneNumber(), e.getMessage(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<CallRecordDTO.Response> recent(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_LIMIT));
        return callRecordRepository.findAllByOrderByTimestampDesc(PageRequest.of(0, size)).stream()
            .map(this::mapToResponse)
            .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public CallRecordDTO.Stats stats() {
        return CallRecordDTO.Stats.builder()
            .totalCalls(callRecordRepository.count())
            .recentCalls24h(callRecordRepository.countByTimestampAfter(clock.instant().minus(Duration.ofHours(24))))
            .build();
    }

    private CallRecordDTO.Response mapToResponse(CallRecord record) {
        return CallRecordDTO.Response.builder()
            .id(record.getId())
            .phoneNumber(record.getPhoneNumber())
            .callerName(record.getCallerName())
            .scenario(record.getScenario())
            .responseText(record.getResponseText())
            .durationSeconds(record.getDurationSeconds())
            .autoAnswered(record.isAutoAnswered())
            .outcome(record.getOutcome())
            .timestamp(record.getTimestamp())
            .build();
    }
}

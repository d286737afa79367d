package com.droidassist.repository;

import com.droidassist.entity.CallRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only call log: save and recency-ordered reads, no lookup by key, no update or delete.
 */
public interface CallRecordRepository extends Repository<CallRecord, UUID> {

    CallRecord save(CallRecord record);

    List<CallRecord> findAllByOrderByTimestampDesc(Pageable pageable);

    long count();

    long countByTimestampAfter(Instant since);
}

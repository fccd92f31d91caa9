package com.dealtracker.poller.infrastructure.db;

import com.dealtracker.common.event.EmailDigest;
import com.dealtracker.common.id.UlidGenerator;
import com.dealtracker.poller.domain.notification.EmailQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.databind.ObjectMapper;

/**
 * Email outbox drained by the delivery service. Idempotency key = {user_id}:{cycle_id}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class EmailOutboxRepositoryAdapter implements EmailQueue {

    static final String STATUS_PENDING = "PENDING";

    private final EmailOutboxJpaRepository jpaRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public void enqueue(String userId, EmailDigest digest) {
        var idempotencyKey = userId + ":" + digest.cycleId();
        var row = EmailOutboxRow.builder()
                .id(UlidGenerator.generate(digest.createdAt()))
                .idempotencyKey(idempotencyKey)
                .userId(userId)
                .recipient(digest.email())
                .subject(digest.subject())
                .payload(objectMapper.writeValueAsString(digest))
                .status(STATUS_PENDING)
                .createdAt(digest.createdAt())
                .build();
        var inserted = jpaRepository.insertIdempotent(row);
        if (inserted == 0) {
            log.debug("Duplicate email batch skipped for {}", idempotencyKey);
        }
    }
}

package com.dealtracker.poller.infrastructure.db;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface EmailOutboxJpaRepository extends JpaRepository<EmailOutboxRow, String> {

    @Modifying
    @Query(value = "INSERT INTO email_outbox (id, idempotency_key, user_id, recipient, subject, payload, status, created_at) " +
            "VALUES (:#{#row.id}, :#{#row.idempotencyKey}, :#{#row.userId}, :#{#row.recipient}, :#{#row.subject}, :#{#row.payload}, :#{#row.status}, :#{#row.createdAt}) " +
            "ON CONFLICT (idempotency_key) DO NOTHING", nativeQuery = true)
    int insertIdempotent(EmailOutboxRow row);

    boolean existsByIdempotencyKey(String idempotencyKey);
}

package com.tenantseed.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.tenantseed.repository.JdbcInserts.timestamp;

/**
 * Direct-message threads with their participants and messages.
 */
@Repository
public class MessageRepository {

    private final JdbcTemplate jdbc;

    public MessageRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Finds a thread by subject among those the given party takes part in.
     */
    public Optional<Long> findThreadId(long tenantId, String subject, long participantPartyId) {
        List<Long> results = jdbc.queryForList("""
            SELECT t.id FROM message_thread t
            WHERE t.tenant_id = ? AND t.subject = ?
              AND EXISTS (SELECT 1 FROM message_participant p WHERE p.thread_id = t.id AND p.party_id = ?)
            ORDER BY t.id
            """,
            Long.class, tenantId, subject, participantPartyId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long saveThread(long tenantId, String subject, String inquiryType, boolean flagged,
                           Instant flaggedAt, boolean archived, Instant lastMessageAt) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO message_thread (tenant_id, subject, inquiry_type, flagged, flagged_at, archived,
                                        last_message_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
            tenantId, subject, inquiryType, flagged, timestamp(flaggedAt), archived, timestamp(lastMessageAt)
        );
    }

    public long saveParticipant(long threadId, long partyId) {
        return JdbcInserts.insert(jdbc,
            "INSERT INTO message_participant (thread_id, party_id) VALUES (?, ?)",
            threadId, partyId);
    }

    public long saveMessage(long threadId, long senderPartyId, String body, Instant createdAt) {
        return JdbcInserts.insert(jdbc,
            "INSERT INTO thread_message (thread_id, sender_party_id, body, created_at) VALUES (?, ?, ?, ?)",
            threadId, senderPartyId, body, timestamp(createdAt));
    }
}

package com.salon.receptionist.dto;

import com.salon.receptionist.entity.ConversationSession;

import java.time.Instant;
import java.time.LocalDate;

public record SessionHistoryEntry(String token, LocalDate sessionDay, String summary, Instant createdAt, Instant lastSeenAt) {

    public static SessionHistoryEntry from(ConversationSession session) {
        return new SessionHistoryEntry(
                session.getToken(),
                session.getSessionDay(),
                session.getSummary(),
                session.getCreatedAt(),
                session.getLastSeenAt()
        );
    }
}

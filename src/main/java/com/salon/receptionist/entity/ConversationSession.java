package com.salon.receptionist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Per-client, per-business-day conversation handle. Rows of earlier days are kept as history.
 */
@Entity
@Table(name = "conversation_session", uniqueConstraints = {
    @UniqueConstraint(name = "uk_session_client_day", columnNames = {"client_id", "session_day"}),
    @UniqueConstraint(name = "uk_session_token", columnNames = {"token"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 40)
    private String token;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "client_id", nullable = false)
    private Client client;

    @Column(name = "session_day", nullable = false)
    private LocalDate sessionDay;

    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private String summary = "";

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (lastSeenAt == null) lastSeenAt = createdAt;
    }
}

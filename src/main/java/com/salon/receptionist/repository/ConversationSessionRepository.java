package com.salon.receptionist.repository;

import com.salon.receptionist.entity.ConversationSession;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface ConversationSessionRepository extends JpaRepository<ConversationSession, Long> {

    Optional<ConversationSession> findByClientIdAndSessionDay(Long clientId, LocalDate sessionDay);

    Optional<ConversationSession> findFirstByClientIdAndSessionDayBeforeOrderBySessionDayDesc(Long clientId, LocalDate day);

    List<ConversationSession> findByClient_PhoneOrderBySessionDayDesc(String phone);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT s FROM ConversationSession s WHERE s.token = :token")
    Optional<ConversationSession> findByTokenForUpdate(@Param("token") String token);

    @Transactional
    @Modifying
    @Query("UPDATE ConversationSession s SET s.lastSeenAt = :seenAt WHERE s.id = :id AND s.lastSeenAt < :seenAt")
    int touch(@Param("id") Long id, @Param("seenAt") Instant seenAt);
}

package com.salon.receptionist.repository;

import com.salon.receptionist.service.SessionContextService;
import jakarta.persistence.QueryHint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.transaction.annotation.Transactional;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Row locks and the transactions that take them must carry a bound, since PostgreSQL waits
 * forever by default.
 */
class LockTimeoutTest {

    private static final String LOCK_TIMEOUT_HINT = "jakarta.persistence.lock.timeout";

    @Test
    @DisplayName("every locking repository query carries a lock timeout hint")
    void lockingQueriesHaveTimeoutHint() {
        List<Method> locking = Stream.of(AppointmentRepository.class, BookingDayRepository.class,
                        ConversationSessionRepository.class)
                .flatMap(repository -> Arrays.stream(repository.getDeclaredMethods()))
                .filter(method -> method.isAnnotationPresent(Lock.class))
                .toList();

        assertThat(locking).extracting(Method::getName)
                .contains("findByIdForUpdate", "findByTokenForUpdate");
        assertThat(locking).allSatisfy(method -> {
            QueryHints hints = method.getAnnotation(QueryHints.class);
            assertThat(hints).as(method.toString()).isNotNull();
            assertThat(hints.value()).extracting(QueryHint::name).contains(LOCK_TIMEOUT_HINT);
        });
    }

    @Test
    @DisplayName("summary updates run in a transaction with a timeout")
    void appendSummaryIsBounded() {
        List<Method> appends = Arrays.stream(SessionContextService.class.getDeclaredMethods())
                .filter(method -> method.getName().equals("appendSummary"))
                .toList();

        assertThat(appends).hasSize(2);
        assertThat(appends).allSatisfy(method ->
                assertThat(method.getAnnotation(Transactional.class).timeout()).isPositive());
    }
}

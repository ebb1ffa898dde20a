package com.salon.receptionist.repository;

import com.salon.receptionist.entity.BookingDay;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface BookingDayRepository extends JpaRepository<BookingDay, LocalDate> {

    /**
     * SELECT FOR UPDATE on the day row; serializes commits for one business date.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT d FROM BookingDay d WHERE d.businessDate = :date")
    Optional<BookingDay> findByIdForUpdate(@Param("date") LocalDate date);
}

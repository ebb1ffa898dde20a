package com.salon.receptionist.repository;

import com.salon.receptionist.entity.Appointment;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    /**
     * Appointments in the given statuses whose {@code [startAt, endAt)} overlaps {@code [start, end)}.
     */
    @Query("""
           SELECT a FROM Appointment a
           WHERE a.startAt < :end
             AND a.endAt > :start
             AND a.status IN :statuses
           ORDER BY a.startAt
           """)
    List<Appointment> findOverlapping(@Param("start") LocalDateTime start,
                                      @Param("end") LocalDateTime end,
                                      @Param("statuses") Collection<Appointment.Status> statuses);

    @Query("""
           SELECT a FROM Appointment a
           JOIN FETCH a.service
           WHERE a.client.phone = :phone
             AND a.startAt >= :from
             AND a.status IN :statuses
           ORDER BY a.startAt
           """)
    List<Appointment> findUpcomingForClient(@Param("phone") String phone,
                                            @Param("from") LocalDateTime from,
                                            @Param("statuses") Collection<Appointment.Status> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);
}

package com.salon.receptionist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * One row per business date. Commits for a date lock this row before re-checking overlaps.
 */
@Entity
@Table(name = "booking_day")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class BookingDay {

    @Id
    @Column(name = "business_date")
    private LocalDate businessDate;
}

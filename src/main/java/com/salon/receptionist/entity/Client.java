package com.salon.receptionist.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "client", uniqueConstraints = {
    @UniqueConstraint(name = "uk_client_phone", columnNames = {"phone"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Client {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** E.164, e.g. +351912345678 */
    @Column(nullable = false, length = 20)
    private String phone;

    @Column(length = 100)
    private String name;

    @Column(length = 100)
    private String email;

    /** JSON object, opaque to scheduling */
    @Column(columnDefinition = "TEXT")
    private String preferences;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}

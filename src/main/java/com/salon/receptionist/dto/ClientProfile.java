package com.salon.receptionist.dto;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of a client as seen by the conversational layer.
 */
public record ClientProfile(
        String phone,
        String name,
        String email,
        Map<String, Object> preferences,
        Instant createdAt
) {
    public boolean hasName() {
        return name != null && !name.isBlank();
    }
}

package com.salon.receptionist.dto;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Everything the conversational layer needs to answer a client on a given business day.
 * The summaries are opaque text owned by that layer.
 *
 * @param token           {@code <phone>_<yyyyMMdd>}, stable for the client and day
 * @param previousSummary summary of the client's most recent earlier day, or {@code null}
 * @param localTime       business-local time of the request
 */
public record SessionContext(
        String token,
        LocalDate sessionDay,
        ClientProfile client,
        String summary,
        String previousSummary,
        List<ServiceDetails> services,
        String salonName,
        String openingHours,
        LocalDateTime localTime,
        Instant createdAt,
        Instant lastSeenAt
) {
}

package com.salon.receptionist.dto;

import com.salon.receptionist.entity.SalonService;

import java.math.BigDecimal;

public record ServiceDetails(
        Long id,
        String name,
        String description,
        int durationMinutes,
        BigDecimal price
) {
    public static ServiceDetails from(SalonService service) {
        return new ServiceDetails(
                service.getId(),
                service.getName(),
                service.getDescription(),
                service.getDurationMinutes(),
                service.getPrice()
        );
    }
}

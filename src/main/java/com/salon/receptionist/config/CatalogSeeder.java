package com.salon.receptionist.config;

import com.salon.receptionist.entity.SalonService;
import com.salon.receptionist.repository.SalonServiceRepository;
import com.salon.receptionist.scheduling.OperatingHours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Idempotent seeder: inserts the default catalog when no service exists yet. Safe to re-run.
 */
@Component
public class CatalogSeeder {

    private static final Logger log = LoggerFactory.getLogger(CatalogSeeder.class);

    static final List<SalonService> DEFAULT_CATALOG = List.of(
            service("Manicure Básica", "Manicure clássica com verniz", 45, "23.00"),
            service("Manicure em Gel", "Manicure com verniz gel de longa duração", 60, "32.00"),
            service("Pedicure Básica", "Pedicure clássica com verniz", 60, "28.00"),
            service("Pedicure em Gel", "Pedicure com verniz gel de longa duração", 75, "37.00"),
            service("Nail Art", "Design personalizado de nail art", 90, "46.00"),
            service("Unhas de Acrílico - Conjunto Completo", "Conjunto completo de unhas de acrílico", 120, "55.00"),
            service("Preenchimento de Acrílico", "Preenchimento de unhas de acrílico", 90, "37.00")
    );

    private final SalonServiceRepository serviceRepository;
    private final OperatingHours operatingHours;
    private final boolean enabled;

    public CatalogSeeder(SalonServiceRepository serviceRepository,
                         OperatingHours operatingHours,
                         @Value("${salon.catalog.seed:true}") boolean enabled) {
        this.serviceRepository = serviceRepository;
        this.operatingHours = operatingHours;
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void seed() {
        if (!enabled) {
            log.info("Catalog seeding disabled");
            return;
        }
        if (serviceRepository.count() > 0) {
            log.info("Catalog already seeded, skipping");
            return;
        }
        int added = 0;
        for (SalonService template : DEFAULT_CATALOG) {
            int duration = template.getDurationMinutes();
            if (!operatingHours.fitsGrid(duration)) {
                log.warn("Skipping service '{}': duration {}min is not a multiple of the {}min slot",
                        template.getName(), duration, operatingHours.granularityMinutes());
                continue;
            }
            serviceRepository.save(SalonService.builder()
                    .name(template.getName())
                    .description(template.getDescription())
                    .durationMinutes(duration)
                    .price(template.getPrice())
                    .active(true)
                    .build());
            added++;
        }
        log.info("Seeded {} services", added);
    }

    private static SalonService service(String name, String description, int minutes, String price) {
        return SalonService.builder()
                .name(name)
                .description(description)
                .durationMinutes(minutes)
                .price(new BigDecimal(price))
                .build();
    }
}

package com.salon.receptionist.config;

import com.salon.receptionist.scheduling.OperatingHours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    public ZoneId businessZone(@Value("${salon.time-zone:Europe/Lisbon}") String zone) {
        return ZoneId.of(zone);
    }

    @Bean
    public Clock clock(ZoneId businessZone) {
        return Clock.system(businessZone);
    }

    @Bean
    public OperatingHours operatingHours(
            @Value("${salon.hours:MON-SAT 09:00-19:00; SUN 11:00-17:00}") String hours,
            @Value("${salon.slot-granularity-minutes:15}") int granularityMinutes) {
        OperatingHours operatingHours = OperatingHours.parse(hours, granularityMinutes);
        log.info("Operating hours: {}", operatingHours);
        return operatingHours;
    }
}

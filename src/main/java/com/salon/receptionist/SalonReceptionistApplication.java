package com.salon.receptionist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.salon.receptionist")
@EnableJpaRepositories(basePackages = "com.salon.receptionist.repository")
@EntityScan(basePackages = "com.salon.receptionist.entity")
public class SalonReceptionistApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalonReceptionistApplication.class, args);
    }
}

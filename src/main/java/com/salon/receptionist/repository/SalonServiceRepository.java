package com.salon.receptionist.repository;

import com.salon.receptionist.entity.SalonService;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SalonServiceRepository extends JpaRepository<SalonService, Long> {

    List<SalonService> findByActiveTrueOrderByIdAsc();

    Optional<SalonService> findByIdAndActiveTrue(Long id);
}

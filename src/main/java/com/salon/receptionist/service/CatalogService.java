package com.salon.receptionist.service;

import com.salon.receptionist.dto.ServiceDetails;
import com.salon.receptionist.entity.SalonService;
import com.salon.receptionist.exception.ResourceNotFoundException;
import com.salon.receptionist.repository.SalonServiceRepository;
import com.salon.receptionist.scheduling.OperatingHours;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read-only access to the service catalog. Services whose duration does not fit the slot grid
 * are treated as not offered.
 */
@Service
@RequiredArgsConstructor
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final SalonServiceRepository serviceRepository;
    private final OperatingHours operatingHours;

    @Transactional(readOnly = true)
    public List<ServiceDetails> listServices() {
        return serviceRepository.findByActiveTrueOrderByIdAsc().stream()
                .filter(this::bookable)
                .map(ServiceDetails::from)
                .toList();
    }

    /**
     * @throws ResourceNotFoundException with {@code UNKNOWN_SERVICE} if absent, inactive or off the slot grid
     */
    @Transactional(readOnly = true)
    public SalonService requireService(Long serviceId) {
        if (serviceId == null) {
            throw ResourceNotFoundException.service(null);
        }
        return serviceRepository.findByIdAndActiveTrue(serviceId)
                .filter(this::bookable)
                .orElseThrow(() -> ResourceNotFoundException.service(serviceId));
    }

    private boolean bookable(SalonService service) {
        if (operatingHours.fitsGrid(service.getDurationMinutes())) {
            return true;
        }
        log.warn("Service {} '{}' lasts {}min, not a multiple of the {}min slot; not offered",
                service.getId(), service.getName(), service.getDurationMinutes(), operatingHours.granularityMinutes());
        return false;
    }
}

package com.salon.receptionist.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salon.receptionist.dto.ClientProfile;
import com.salon.receptionist.entity.Client;
import com.salon.receptionist.exception.ResourceNotFoundException;
import com.salon.receptionist.repository.ClientRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Client records keyed by E.164 phone number. Clients are never deleted.
 */
@Service
@RequiredArgsConstructor
public class ClientService {

    private static final Logger log = LoggerFactory.getLogger(ClientService.class);
    private static final TypeReference<Map<String, Object>> PREFERENCES_TYPE = new TypeReference<>() {};

    private final ClientRepository clientRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Returns the client for the phone, creating it on first contact. Concurrent first contacts
     * converge on the row that won the unique phone constraint.
     */
    public Client upsertByPhone(String phone) {
        return clientRepository.findByPhone(phone).orElseGet(() -> insert(phone));
    }

    private Client insert(String phone) {
        try {
            Client client = clientRepository.saveAndFlush(Client.builder()
                    .phone(phone)
                    .createdAt(clock.instant())
                    .build());
            log.info("New client {}", phone);
            return client;
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            log.debug("Client {} was created concurrently, reloading", phone);
            return clientRepository.findByPhone(phone).orElseThrow(() -> e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<Client> findByPhone(String phone) {
        return clientRepository.findByPhone(phone);
    }

    @Transactional
    public ClientProfile updateName(String phone, String name) {
        Client client = require(phone);
        client.setName(StringUtils.trimToNull(name));
        log.info("Updated name for {} to {}", phone, client.getName());
        return toProfile(client);
    }

    @Transactional
    public ClientProfile updatePreferences(String phone, Map<String, Object> preferences) {
        Client client = require(phone);
        try {
            client.setPreferences(preferences == null || preferences.isEmpty()
                    ? null
                    : objectMapper.writeValueAsString(preferences));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Preferences are not serializable: " + e.getOriginalMessage(), e);
        }
        return toProfile(client);
    }

    public ClientProfile toProfile(Client client) {
        return new ClientProfile(
                client.getPhone(),
                client.getName(),
                client.getEmail(),
                readPreferences(client),
                client.getCreatedAt()
        );
    }

    private Map<String, Object> readPreferences(Client client) {
        if (StringUtils.isBlank(client.getPreferences())) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(client.getPreferences(), PREFERENCES_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored preferences of client " + client.getPhone() + " are not valid JSON", e);
        }
    }

    private Client require(String phone) {
        return clientRepository.findByPhone(phone).orElseThrow(() -> ResourceNotFoundException.client(phone));
    }
}

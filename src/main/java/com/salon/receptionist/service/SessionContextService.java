package com.salon.receptionist.service;

import com.salon.receptionist.dto.SessionContext;
import com.salon.receptionist.dto.SessionHistoryEntry;
import com.salon.receptionist.entity.Client;
import com.salon.receptionist.entity.ConversationSession;
import com.salon.receptionist.exception.BookingError;
import com.salon.receptionist.exception.ResourceNotFoundException;
import com.salon.receptionist.repository.ConversationSessionRepository;
import com.salon.receptionist.scheduling.OperatingHours;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * One conversation session per client per business-local calendar day. Sessions of earlier
 * days stay in storage as history but are never returned as current.
 */
@Service
public class SessionContextService {

    private static final Logger log = LoggerFactory.getLogger(SessionContextService.class);
    private static final DateTimeFormatter TOKEN_DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private final ClientService clientService;
    private final CatalogService catalogService;
    private final ConversationSessionRepository sessionRepository;
    private final OperatingHours operatingHours;
    private final ZoneId businessZone;
    private final String salonName;
    private final int summaryMaxLength;

    public SessionContextService(ClientService clientService,
                                 CatalogService catalogService,
                                 ConversationSessionRepository sessionRepository,
                                 OperatingHours operatingHours,
                                 ZoneId businessZone,
                                 @Value("${salon.name:Elegant Nails Spa}") String salonName,
                                 @Value("${salon.session.summary-max-length:4000}") int summaryMaxLength) {
        this.clientService = clientService;
        this.catalogService = catalogService;
        this.sessionRepository = sessionRepository;
        this.operatingHours = operatingHours;
        this.businessZone = businessZone;
        this.salonName = salonName;
        this.summaryMaxLength = summaryMaxLength;
    }

    public static String token(String phone, LocalDate day) {
        return phone + "_" + day.format(TOKEN_DAY);
    }

    /**
     * Resolves the current session of the client for the business day containing {@code now},
     * creating the client and the session on first contact.
     */
    public SessionContext resolve(String phone, Instant now) {
        LocalDate day = now.atZone(businessZone).toLocalDate();
        Client client = clientService.upsertByPhone(phone);
        ConversationSession session = sessionRepository.findByClientIdAndSessionDay(client.getId(), day)
                .orElseGet(() -> create(client, day, now));
        if (sessionRepository.touch(session.getId(), now) > 0) {
            session.setLastSeenAt(now);
        }
        return toContext(client, session, now);
    }

    private ConversationSession create(Client client, LocalDate day, Instant now) {
        try {
            ConversationSession session = sessionRepository.saveAndFlush(ConversationSession.builder()
                    .token(token(client.getPhone(), day))
                    .client(client)
                    .sessionDay(day)
                    .summary("")
                    .createdAt(now)
                    .lastSeenAt(now)
                    .build());
            log.info("Started session {}", session.getToken());
            return session;
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            log.debug("Session for {} on {} was created concurrently, reloading", client.getPhone(), day);
            return sessionRepository.findByClientIdAndSessionDay(client.getId(), day).orElseThrow(() -> e);
        }
    }

    private SessionContext toContext(Client client, ConversationSession session, Instant now) {
        String previousSummary = sessionRepository
                .findFirstByClientIdAndSessionDayBeforeOrderBySessionDayDesc(client.getId(), session.getSessionDay())
                .map(ConversationSession::getSummary)
                .filter(StringUtils::isNotBlank)
                .orElse(null);
        return new SessionContext(
                session.getToken(),
                session.getSessionDay(),
                clientService.toProfile(client),
                session.getSummary(),
                previousSummary,
                catalogService.listServices(),
                salonName,
                operatingHours.describe(),
                now.atZone(businessZone).toLocalDateTime(),
                session.getCreatedAt(),
                session.getLastSeenAt()
        );
    }

    /**
     * Appends a note to the session's rolling summary, keeping only the newest characters.
     *
     * @return the stored summary
     */
    @Transactional(timeout = BookingLedger.TX_TIMEOUT_SECONDS)
    public String appendSummary(SessionContext context, String note) {
        return appendSummary(context.token(), note);
    }

    @Transactional(timeout = BookingLedger.TX_TIMEOUT_SECONDS)
    public String appendSummary(String token, String note) {
        ConversationSession session = sessionRepository.findByTokenForUpdate(token)
                .orElseThrow(() -> new ResourceNotFoundException(BookingError.NOT_FOUND, "Session", token));
        if (StringUtils.isBlank(note)) {
            return session.getSummary();
        }
        String current = Objects.toString(session.getSummary(), "");
        String combined = current.isEmpty() ? note.trim() : current + "\n" + note.trim();
        if (combined.length() > summaryMaxLength) {
            combined = combined.substring(combined.length() - summaryMaxLength);
        }
        session.setSummary(combined);
        return combined;
    }

    @Transactional(readOnly = true)
    public List<SessionHistoryEntry> history(String phone) {
        return sessionRepository.findByClient_PhoneOrderBySessionDayDesc(phone).stream()
                .map(SessionHistoryEntry::from)
                .toList();
    }
}

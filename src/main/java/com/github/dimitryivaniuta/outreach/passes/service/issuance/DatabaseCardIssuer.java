package com.github.dimitryivaniuta.outreach.passes.service.issuance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.outreach.passes.domain.Attendee;
import com.github.dimitryivaniuta.outreach.passes.domain.Card;
import com.github.dimitryivaniuta.outreach.passes.repo.CardRepository;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Stores event cards in the {@code cards} table.
 *
 * <p>An existing card owned by the attendee is returned instead of creating another one; the unique
 * {@code owner_attendee_id} column resolves concurrent creation in favour of the first insert.</p>
 */
@Component
public class DatabaseCardIssuer implements CardIssuer {

    private static final Logger log = LoggerFactory.getLogger(DatabaseCardIssuer.class);

    private final CardRepository cardRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DatabaseCardIssuer(CardRepository cardRepository, ObjectMapper objectMapper, Clock clock) {
        this.cardRepository = cardRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String createCard(Attendee attendee) {
        Card existing = cardRepository.findByOwnerAttendeeId(attendee.getAttendeeId()).orElse(null);
        if (existing != null) {
            log.info("Reusing card {} owned by attendee {}", existing.getCardId(), attendee.getAttendeeId());
            return existing.getCardId();
        }

        Card card = Card.forAttendee(attendee, linksJson(attendee), clock.instant());
        try {
            cardRepository.saveAndFlush(card);
        } catch (DataIntegrityViolationException ex) {
            // Lost the insert race for this attendee; the winner's card is the one to use.
            return cardRepository.findByOwnerAttendeeId(attendee.getAttendeeId())
                    .map(Card::getCardId)
                    .orElseThrow(() -> new IssuanceException("Unable to create card for attendee " + attendee.getAttendeeId(), ex));
        }

        log.info("Created card {} for attendee {}", card.getCardId(), attendee.getAttendeeId());
        return card.getCardId();
    }

    private String linksJson(Attendee attendee) {
        Map<String, String> links = new LinkedHashMap<>();
        if (attendee.getLinkedinUrl() != null && !attendee.getLinkedinUrl().isBlank()) {
            links.put("linkedin", attendee.getLinkedinUrl());
        }
        try {
            return objectMapper.writeValueAsString(links);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize card links", e);
        }
    }
}

package com.github.dimitryivaniuta.outreach.passes.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Digital contact card issued for an attendee.
 *
 * <p>{@code owner_attendee_id} is unique: an attendee owns at most one event card, which backs the
 * "never two cards per attendee" rule even if a job's progress was lost.</p>
 */
@Entity
@Table(name = "cards")
@Getter
@Setter
@NoArgsConstructor
public class Card {

    @Id
    @Column(name = "card_id", nullable = false, updatable = false, length = 36)
    private String cardId;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 36)
    private String tenantId;

    @Column(name = "owner_attendee_id", nullable = false, updatable = false, length = 36, unique = true)
    private String ownerAttendeeId;

    @Column(name = "display_name", nullable = false, length = 512)
    private String displayName;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "phone", length = 64)
    private String phone;

    @Column(name = "org_name", length = 256)
    private String orgName;

    @Column(name = "title", length = 256)
    private String title;

    @Column(name = "links_json", nullable = false, columnDefinition = "text")
    private String linksJson;

    @Column(name = "personal", nullable = false)
    private boolean personal;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Builds an event (non-personal) card from the attendee's contact fields.
     *
     * @param attendee attendee
     * @param linksJson links JSON (e.g. linkedin)
     * @param now creation time
     * @return card
     */
    public static Card forAttendee(Attendee attendee, String linksJson, Instant now) {
        Card c = new Card();
        c.cardId = UUID.randomUUID().toString();
        c.tenantId = attendee.getTenantId();
        c.ownerAttendeeId = attendee.getAttendeeId();
        c.displayName = attendee.displayName();
        c.email = attendee.getEmail();
        c.phone = attendee.getPhone();
        c.orgName = attendee.getOrgName();
        c.title = attendee.getTitle();
        c.linksJson = linksJson == null ? "{}" : linksJson;
        c.personal = false;
        c.createdAt = now;
        return c;
    }
}

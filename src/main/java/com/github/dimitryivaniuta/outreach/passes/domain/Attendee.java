package com.github.dimitryivaniuta.outreach.passes.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Event attendee. Owned by the admin API; the worker reads contact fields and links the issued card.
 */
@Entity
@Table(
        name = "attendees",
        indexes = @Index(name = "idx_attendees_tenant", columnList = "tenant_id")
)
@Getter
@Setter
@NoArgsConstructor
public class Attendee {

    @Id
    @Column(name = "attendee_id", nullable = false, updatable = false, length = 36)
    private String attendeeId;

    @Column(name = "event_id", nullable = true, length = 36)
    private String eventId;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 36)
    private String tenantId;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "phone", length = 64)
    private String phone;

    @Column(name = "first_name", length = 256)
    private String firstName;

    @Column(name = "last_name", length = 256)
    private String lastName;

    @Column(name = "org_name", length = 256)
    private String orgName;

    @Column(name = "title", length = 256)
    private String title;

    @Column(name = "linkedin_url", length = 512)
    private String linkedinUrl;

    /**
     * Authoritative attendee to card link, set when a job completes.
     */
    @Column(name = "card_id", nullable = true, length = 36)
    private String cardId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Factory method.
     *
     * @param tenantId tenant
     * @param eventId event
     * @param firstName first name
     * @param lastName last name
     * @param email email
     * @return attendee
     */
    public static Attendee newAttendee(String tenantId, String eventId, String firstName, String lastName, String email) {
        Attendee a = new Attendee();
        a.attendeeId = UUID.randomUUID().toString();
        a.tenantId = tenantId;
        a.eventId = eventId;
        a.firstName = firstName;
        a.lastName = lastName;
        a.email = email;
        a.createdAt = Instant.now();
        return a;
    }

    /**
     * Name shown on the card: first and last name, falling back to email, then "Attendee".
     *
     * @return display name
     */
    public String displayName() {
        String name = ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
        if (!name.isEmpty()) {
            return name;
        }
        return email != null && !email.isBlank() ? email : "Attendee";
    }

    /**
     * @return true when the attendee can receive the pass email
     */
    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}

package com.github.dimitryivaniuta.outreach.passes.repo;

import com.github.dimitryivaniuta.outreach.passes.domain.Attendee;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * JPA repository for {@link Attendee}.
 */
public interface AttendeeRepository extends JpaRepository<Attendee, String> {

    /**
     * Finds the attendee and locks the row for the duration of the transaction.
     *
     * <p>Serializes issuance requests for one attendee where no unique index does.</p>
     *
     * @param attendeeId attendee
     * @return attendee
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Attendee a where a.attendeeId = :attendeeId")
    Optional<Attendee> findByIdForUpdate(@Param("attendeeId") String attendeeId);

    /**
     * Links the issued card to the attendee unless a card is already linked.
     *
     * @param attendeeId attendee
     * @param cardId card
     * @return 1 if the link was written
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Attendee a set a.cardId = :cardId where a.attendeeId = :attendeeId and a.cardId is null")
    int linkCardIfAbsent(@Param("attendeeId") String attendeeId, @Param("cardId") String cardId);
}

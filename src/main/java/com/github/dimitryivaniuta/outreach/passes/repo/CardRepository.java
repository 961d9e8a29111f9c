package com.github.dimitryivaniuta.outreach.passes.repo;

import com.github.dimitryivaniuta.outreach.passes.domain.Card;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * JPA repository for {@link Card}.
 */
public interface CardRepository extends JpaRepository<Card, String> {

    Optional<Card> findByOwnerAttendeeId(String ownerAttendeeId);

    long countByOwnerAttendeeId(String ownerAttendeeId);
}

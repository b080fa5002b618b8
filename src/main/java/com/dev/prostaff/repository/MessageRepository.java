package com.dev.prostaff.repository;

import com.dev.prostaff.domain.Message;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MessageRepository extends JpaRepository<Message, UUID> {

    Optional<Message> findByIdAndOrganizationId(UUID id, UUID organizationId);

    @Query("""
            select m from Message m join fetch m.sender
            where m.organizationId = :organizationId
              and m.deleted = false
              and m.createdAt < :before
              and ((m.sender.id = :userA and m.recipient.id = :userB)
                or (m.sender.id = :userB and m.recipient.id = :userA))
            order by m.createdAt desc
            """)
    List<Message> findConversation(@Param("organizationId") UUID organizationId,
                                   @Param("userA") UUID userA,
                                   @Param("userB") UUID userB,
                                   @Param("before") OffsetDateTime before,
                                   Pageable pageable);
}

package io.hireflow.forms.repo;

import io.hireflow.forms.domain.FormInvitation;
import io.hireflow.forms.domain.InvitationStatus;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface FormInvitationRepository extends JpaRepository<FormInvitation, UUID> {

    Optional<FormInvitation> findByToken(String token);

    /**
     * Token lookup that holds a row lock until the surrounding transaction ends. Used by submit so
     * that two concurrent submissions of the same link are serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM FormInvitation i WHERE i.token = :token")
    Optional<FormInvitation> findByTokenForUpdate(String token);

    Optional<FormInvitation> findFirstByApplicationIdAndFormIdAndStatusIn(
            UUID applicationId, UUID formId, Collection<InvitationStatus> statuses);

    Optional<FormInvitation> findByIdAndOrganizationId(UUID id, UUID organizationId);

    List<FormInvitation> findByApplicationIdAndOrganizationIdOrderByCreatedAtDesc(UUID applicationId, UUID organizationId);

    boolean existsByFormId(UUID formId);

    /**
     * Bulk-expires overdue active invitations. Bumps {@code version} so any in-flight holder of an
     * affected row fails its optimistic check instead of overwriting the expiry.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE FormInvitation i
               SET i.status = :expired,
                   i.version = i.version + 1
             WHERE i.status IN :active
               AND i.expiresAt < :now
            """)
    int expireOverdue(InvitationStatus expired, Collection<InvitationStatus> active, OffsetDateTime now);
}

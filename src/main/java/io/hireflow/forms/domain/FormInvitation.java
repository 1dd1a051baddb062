package io.hireflow.forms.domain;

import io.hireflow.forms.errors.InvalidTransitionException;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A tokenized, single-use request for one application to fill in one form.
 *
 * <p>Status only changes through {@link #transitionTo(InvitationStatus, OffsetDateTime)}; the
 * {@code version} column makes concurrent writers of the same row lose with an optimistic lock failure.
 */
@Entity
@Table(name = "form_invitations")
@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = {"token", "fieldSnapshot"})
public class FormInvitation {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private UUID organizationId;

    @Column(name = "application_id", nullable = false)
    private UUID applicationId;

    @Column(name = "form_id", nullable = false)
    private UUID formId;

    @Column(name = "token", nullable = false, unique = true, length = 64)
    private String token;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.NAMED_ENUM)
    @Column(name = "status", nullable = false, columnDefinition = "invitation_status_enum")
    private InvitationStatus status = InvitationStatus.PENDING;

    @Column(name = "sent_at")
    private OffsetDateTime sentAt;

    @Column(name = "viewed_at")
    private OffsetDateTime viewedAt;

    @Column(name = "answered_at")
    private OffsetDateTime answeredAt;

    @Column(name = "sent_by", nullable = false)
    private UUID sentBy;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "field_snapshot", nullable = false, columnDefinition = "jsonb")
    private FormSnapshot fieldSnapshot;

    @Column(name = "custom_message", columnDefinition = "text")
    private String customMessage;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "reminder_sent_at")
    private OffsetDateTime reminderSentAt;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Version
    @Column(name = "version")
    private Long version;

    public void transitionTo(final InvitationStatus target, final OffsetDateTime at) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(status, target);
        }
        switch (target) {
            case SENT -> {
                this.sentAt = at;
                this.errorMessage = null;
            }
            case VIEWED -> this.viewedAt = at;
            case ANSWERED -> this.answeredAt = at;
            default -> {
                // expired and failed carry no timestamp of their own
            }
        }
        this.status = target;
    }

    public boolean isActive() {
        return status.isActive();
    }

    /**
     * True once {@code now} is strictly after the expiry instant, whatever the stored status says.
     * Matches the {@code expiresAt < now} condition of the bulk sweep.
     */
    public boolean isPastExpiry(final OffsetDateTime now) {
        return now.isAfter(expiresAt);
    }
}

package io.hireflow.forms.services;

import static io.hireflow.forms.util.TimeUtils.utcNow;

import io.hireflow.forms.domain.FormInvitation;
import io.hireflow.forms.domain.FormResponse;
import io.hireflow.forms.domain.InvitationStatus;
import io.hireflow.forms.errors.AlreadyAnsweredException;
import io.hireflow.forms.errors.InvitationFailedException;
import io.hireflow.forms.errors.TokenExpiredException;
import io.hireflow.forms.repo.FormInvitationRepository;
import io.hireflow.forms.repo.FormResponseRepository;
import io.hireflow.forms.token.TokenIssuer;

import java.time.Clock;
import java.time.OffsetDateTime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Decides whether a candidate may still use an invitation. Shared by resolve, upload and submit.
 */
@Slf4j
@Component
public class InvitationGuard {

    private final TokenIssuer tokenIssuer;
    private final FormInvitationRepository formInvitationRepository;
    private final FormResponseRepository formResponseRepository;
    private final Clock clock;

    public InvitationGuard(
            final TokenIssuer tokenIssuer,
            final FormInvitationRepository formInvitationRepository,
            final FormResponseRepository formResponseRepository,
            final Clock clock
    ) {
        this.tokenIssuer = tokenIssuer;
        this.formInvitationRepository = formInvitationRepository;
        this.formResponseRepository = formResponseRepository;
        this.clock = clock;
    }

    /**
     * Looks the token up and applies {@link #checkUsable}. An overdue invitation is marked expired
     * and that change commits even though the call throws.
     */
    @Transactional(noRollbackFor = TokenExpiredException.class)
    public FormInvitation requireUsable(final String token) {
        final FormInvitation invitation = tokenIssuer.validateForUpdate(token);
        checkUsable(invitation, utcNow(clock));
        return invitation;
    }

    /**
     * Rejects an invitation that is past its expiry, answered, expired or failed. Must run inside a
     * transaction that does not roll back on {@link TokenExpiredException}.
     */
    public void checkUsable(final FormInvitation invitation, final OffsetDateTime now) {
        if (invitation.isPastExpiry(now)) {
            if (invitation.isActive()) {
                invitation.transitionTo(InvitationStatus.EXPIRED, now);
                formInvitationRepository.save(invitation);
                log.info("Invitation id={} expired on access", invitation.getId());
            }
            if (invitation.getStatus() != InvitationStatus.ANSWERED) {
                throw new TokenExpiredException();
            }
        }
        switch (invitation.getStatus()) {
            case ANSWERED -> throw new AlreadyAnsweredException(formResponseRepository.findByInvitationId(invitation.getId())
                    .map(FormResponse::getId)
                    .orElse(null));
            case EXPIRED -> throw new TokenExpiredException();
            case FAILED -> throw new InvitationFailedException();
            default -> {
                // pending, sent and viewed are usable
            }
        }
    }
}

package io.hireflow.forms.scheduling;

import static io.hireflow.forms.util.TimeUtils.utcNow;

import io.hireflow.forms.config.SweepProperties;
import io.hireflow.forms.domain.InvitationStatus;
import io.hireflow.forms.repo.FormInvitationRepository;

import java.time.Clock;
import java.time.OffsetDateTime;

import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Periodically marks active invitations whose link has lapsed as expired.
 *
 * <p>Resolve and submit also expire an overdue invitation on access; the sweep keeps recruiter
 * views and the one-active-invitation rule accurate for links nobody opens. Only one instance in
 * the cluster sweeps at a time (ShedLock).
 */
@Slf4j
@Component
public class InvitationExpirySweeper {

    private static final String LOG_PREFIX = "InvitationExpirySweeper: ";

    private final SweepProperties sweepProperties;
    private final FormInvitationRepository formInvitationRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public InvitationExpirySweeper(
            final SweepProperties sweepProperties,
            final FormInvitationRepository formInvitationRepository,
            final PlatformTransactionManager platformTransactionManager,
            final Clock clock
    ) {
        this.sweepProperties = sweepProperties;
        this.formInvitationRepository = formInvitationRepository;
        this.transactionTemplate = new TransactionTemplate(platformTransactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${forms.invitation.sweep.delay-ms:900000}")
    @SchedulerLock(name = "invitationExpirySweep", lockAtLeastFor = "PT30S", lockAtMostFor = "PT10M")
    public void sweep() {
        if (!sweepProperties.isEnabled()) {
            return;
        }
        final int expired = expireOverdue(utcNow(clock));
        if (expired > 0) {
            log.info(LOG_PREFIX + "expired {} overdue invitation(s)", Integer.valueOf(expired));
        } else {
            log.debug(LOG_PREFIX + "nothing to expire");
        }
    }

    /**
     * Runs one sweep pass as of {@code now}.
     *
     * @return number of invitations moved to expired
     */
    public int expireOverdue(final OffsetDateTime now) {
        final Integer updated = transactionTemplate.execute(status ->
                formInvitationRepository.expireOverdue(InvitationStatus.EXPIRED, InvitationStatus.ACTIVE, now));
        return updated == null ? 0 : updated;
    }
}

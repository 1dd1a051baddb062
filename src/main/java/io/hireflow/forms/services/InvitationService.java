package io.hireflow.forms.services;

import static io.hireflow.forms.util.TimeUtils.utcNow;

import io.hireflow.forms.clients.mail.DeliveryResult;
import io.hireflow.forms.clients.mail.InvitationEmail;
import io.hireflow.forms.clients.mail.InvitationMailer;
import io.hireflow.forms.config.FormsProperties;
import io.hireflow.forms.domain.CandidateApplication;
import io.hireflow.forms.domain.FormInvitation;
import io.hireflow.forms.domain.FormSnapshot;
import io.hireflow.forms.domain.InvitationStatus;
import io.hireflow.forms.errors.DuplicateActiveInvitationException;
import io.hireflow.forms.errors.FormValidationException;
import io.hireflow.forms.errors.InvalidTransitionException;
import io.hireflow.forms.errors.TokenExpiredException;
import io.hireflow.forms.model.BulkIssueRequest;
import io.hireflow.forms.model.BulkIssueResponse;
import io.hireflow.forms.model.BulkIssueResponse.Item;
import io.hireflow.forms.model.BulkIssueResponse.Outcome;
import io.hireflow.forms.model.InvitationResponse;
import io.hireflow.forms.model.IssueInvitationRequest;
import io.hireflow.forms.model.PublicFormView;
import io.hireflow.forms.model.RecruiterContext;
import io.hireflow.forms.quota.CounterKind;
import io.hireflow.forms.quota.QuotaDecision;
import io.hireflow.forms.quota.QuotaLedger;
import io.hireflow.forms.repo.CandidateApplicationRepository;
import io.hireflow.forms.repo.FormInvitationRepository;
import io.hireflow.forms.services.mapper.FormsMapper;
import io.hireflow.forms.token.TokenIssuer;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

/**
 * Issues, re-issues and resolves form invitations.
 *
 * <p>Issuing spans several short transactions: the quota unit commits on its own, the pending
 * row commits before the email goes out, and the sent/failed outcome is written afterwards.
 * No database transaction is open while the mailer runs.
 */
@Slf4j
@Service
public class InvitationService {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final FormInvitationRepository formInvitationRepository;
    private final CandidateApplicationRepository candidateApplicationRepository;
    private final TemplateService templateService;
    private final QuotaLedger quotaLedger;
    private final TokenIssuer tokenIssuer;
    private final InvitationMailer invitationMailer;
    private final InvitationGuard invitationGuard;
    private final FormsProperties formsProperties;
    private final FormsMapper mapper;
    private final Clock clock;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;

    public InvitationService(
            final FormInvitationRepository formInvitationRepository,
            final CandidateApplicationRepository candidateApplicationRepository,
            final TemplateService templateService,
            final QuotaLedger quotaLedger,
            final TokenIssuer tokenIssuer,
            final InvitationMailer invitationMailer,
            final InvitationGuard invitationGuard,
            final FormsProperties formsProperties,
            final FormsMapper mapper,
            final Clock clock,
            final PlatformTransactionManager platformTransactionManager
    ) {
        this.formInvitationRepository = formInvitationRepository;
        this.candidateApplicationRepository = candidateApplicationRepository;
        this.templateService = templateService;
        this.quotaLedger = quotaLedger;
        this.tokenIssuer = tokenIssuer;
        this.invitationMailer = invitationMailer;
        this.invitationGuard = invitationGuard;
        this.formsProperties = formsProperties;
        this.mapper = mapper;
        this.clock = clock;
        this.writeTx = new TransactionTemplate(platformTransactionManager);
        this.readTx = new TransactionTemplate(platformTransactionManager);
        this.readTx.setReadOnly(true);
    }

    private record IssueTarget(CandidateApplication application, UUID formId, FormSnapshot snapshot, String customMessage) {
    }

    public InvitationResponse issue(final RecruiterContext recruiter, final IssueInvitationRequest request) {
        final IssueTarget target = readTx.execute(status -> {
            final CandidateApplication application = requireApplication(recruiter, request.applicationId());
            final FormSnapshot snapshot = FormSnapshot.of(templateService.requireVisible(recruiter, request.formId()));
            ensureNoActive(request.applicationId(), request.formId(), utcNow(clock), false);
            return new IssueTarget(application, request.formId(), snapshot, request.customMessage());
        });

        quotaLedger.consumeOrThrow(recruiter.recruiterId(), CounterKind.INVITATIONS_SENT);

        final FormInvitation pending = persistPending(recruiter, target);
        final FormInvitation outcome = deliver(pending, target.application(), false);
        return mapper.toInvitationResponse(outcome);
    }

    /**
     * Issues the same form to many applications. One snapshot is taken for the whole batch and
     * each application gets its own outcome instead of failing the call.
     */
    public BulkIssueResponse bulkIssue(final RecruiterContext recruiter, final BulkIssueRequest request) {
        final int max = formsProperties.getInvitation().getBulkMax();
        if (request.applicationIds().size() > max) {
            throw new FormValidationException("applicationIds", "At most " + max + " applications per request");
        }
        final FormSnapshot snapshot = readTx.execute(status ->
                FormSnapshot.of(templateService.requireVisible(recruiter, request.formId())));

        final List<Item> results = new ArrayList<>();
        for (final UUID applicationId : new LinkedHashSet<>(request.applicationIds())) {
            results.add(issueOne(recruiter, applicationId, request.formId(), snapshot, request.customMessage()));
        }

        final Map<String, Integer> summary = new LinkedHashMap<>();
        for (final Outcome outcome : Outcome.values()) {
            summary.put(outcome.wire(), 0);
        }
        results.forEach(item -> summary.merge(item.outcome().wire(), 1, Integer::sum));
        log.info("Bulk issue form={} requested={} summary={}", request.formId(),
                Integer.valueOf(request.applicationIds().size()), summary);
        return new BulkIssueResponse(results, summary);
    }

    private Item issueOne(final RecruiterContext recruiter,
                          final UUID applicationId,
                          final UUID formId,
                          final FormSnapshot snapshot,
                          final String customMessage) {
        final Optional<CandidateApplication> found = readTx.execute(status -> candidateApplicationRepository.findById(applicationId));
        if (found == null || found.isEmpty()) {
            return new Item(applicationId, Outcome.NOT_FOUND, null, "Application not found");
        }
        final CandidateApplication application = found.get();
        if (!application.getOrganizationId().equals(recruiter.organizationId())) {
            return new Item(applicationId, Outcome.UNAUTHORIZED, null, "Application belongs to another organization");
        }
        if (application.isClosed()) {
            return new Item(applicationId, Outcome.SKIPPED, null, "Application is " + application.getStatus());
        }
        final Optional<FormInvitation> active = readTx.execute(status -> findBlockingActive(applicationId, formId, utcNow(clock)));
        if (active != null && active.isPresent()) {
            return new Item(applicationId, Outcome.DUPLICATE, active.get().getId(), "Active invitation already exists");
        }

        final QuotaDecision decision = quotaLedger.tryConsume(recruiter.recruiterId(), CounterKind.INVITATIONS_SENT);
        if (!decision.allowed()) {
            return new Item(applicationId, Outcome.QUOTA_EXCEEDED, null,
                    "Daily invitation limit of " + decision.limit() + " reached");
        }

        final FormInvitation pending;
        try {
            pending = persistPending(recruiter, new IssueTarget(application, formId, snapshot, customMessage));
        } catch (DuplicateActiveInvitationException e) {
            return new Item(applicationId, Outcome.DUPLICATE, e.getExistingInvitationId(), e.getMessage());
        }
        final FormInvitation outcome = deliver(pending, application, false);
        if (outcome.getStatus() == InvitationStatus.SENT) {
            return new Item(applicationId, Outcome.CREATED, outcome.getId(), null);
        }
        return new Item(applicationId, Outcome.EMAIL_FAILED, outcome.getId(), outcome.getErrorMessage());
    }

    /**
     * Re-issues a failed or expired invitation as a brand-new row with a fresh token, expiry and
     * snapshot of the current template. The old row is left untouched. Consumes a quota unit.
     */
    public InvitationResponse resend(final RecruiterContext recruiter, final UUID invitationId, final String customMessage) {
        final IssueTarget target = writeTx.execute(status -> {
            final FormInvitation previous = requireInvitation(recruiter, invitationId);
            final OffsetDateTime now = utcNow(clock);
            if (previous.isActive() && previous.isPastExpiry(now)) {
                previous.transitionTo(InvitationStatus.EXPIRED, now);
                formInvitationRepository.save(previous);
            }
            if (previous.getStatus() != InvitationStatus.FAILED && previous.getStatus() != InvitationStatus.EXPIRED) {
                throw new InvalidTransitionException(previous.getStatus(), InvitationStatus.PENDING,
                        "Only failed or expired invitations can be resent");
            }
            final CandidateApplication application = requireApplication(recruiter, previous.getApplicationId());
            final FormSnapshot snapshot = FormSnapshot.of(templateService.requireVisible(recruiter, previous.getFormId()));
            return new IssueTarget(application, previous.getFormId(), snapshot,
                    customMessage != null ? customMessage : previous.getCustomMessage());
        });

        quotaLedger.consumeOrThrow(recruiter.recruiterId(), CounterKind.INVITATIONS_SENT);

        final FormInvitation pending = persistPending(recruiter, target);
        final FormInvitation outcome = deliver(pending, target.application(), false);
        log.info("Resent invitation previous={} new={} status={}", invitationId, outcome.getId(), outcome.getStatus());
        return mapper.toInvitationResponse(outcome);
    }

    /**
     * Emails the existing link again. No status change; consumes a quota unit.
     */
    public InvitationResponse remind(final RecruiterContext recruiter, final UUID invitationId) {
        final FormInvitation invitation = readTx.execute(status -> {
            final FormInvitation found = requireInvitation(recruiter, invitationId);
            if (found.getStatus() != InvitationStatus.SENT && found.getStatus() != InvitationStatus.VIEWED) {
                throw new InvalidTransitionException(found.getStatus(), found.getStatus(),
                        "Only sent or viewed invitations can be reminded");
            }
            if (found.isPastExpiry(utcNow(clock))) {
                throw new InvalidTransitionException(found.getStatus(), InvitationStatus.EXPIRED,
                        "Invitation has expired; resend it instead");
            }
            return found;
        });
        final CandidateApplication application = readTx.execute(status ->
                requireApplication(recruiter, invitation.getApplicationId()));

        quotaLedger.consumeOrThrow(recruiter.recruiterId(), CounterKind.INVITATIONS_SENT);

        final DeliveryResult result = send(invitation, application, true);
        if (!result.success()) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "Reminder could not be delivered: " + result.error());
        }
        final FormInvitation updated = writeTx.execute(status -> {
            final FormInvitation current = formInvitationRepository.findById(invitationId)
                    .orElseThrow(() -> new IllegalStateException("Invitation vanished: " + invitationId));
            current.setReminderSentAt(utcNow(clock));
            return formInvitationRepository.save(current);
        });
        log.info("Reminder sent for invitation id={}", invitationId);
        return mapper.toInvitationResponse(updated);
    }

    @Transactional(readOnly = true)
    public List<InvitationResponse> listForApplication(final RecruiterContext recruiter, final UUID applicationId) {
        requireApplication(recruiter, applicationId);
        return formInvitationRepository
                .findByApplicationIdAndOrganizationIdOrderByCreatedAtDesc(applicationId, recruiter.organizationId())
                .stream()
                .map(mapper::toInvitationResponse)
                .toList();
    }

    /**
     * Candidate opens a link. First resolution of a sent invitation records the view; the frozen
     * snapshot is returned either way. The row lock makes overlapping opens and the expiry sweep
     * queue behind each other, so a later open sees the committed status.
     */
    @Transactional(noRollbackFor = TokenExpiredException.class)
    public PublicFormView resolve(final String token) {
        final FormInvitation invitation = tokenIssuer.validateForUpdate(token);
        final OffsetDateTime now = utcNow(clock);
        invitationGuard.checkUsable(invitation, now);
        if (invitation.getStatus() == InvitationStatus.SENT) {
            invitation.transitionTo(InvitationStatus.VIEWED, now);
            formInvitationRepository.save(invitation);
            log.info("Invitation id={} viewed token={}", invitation.getId(), TokenIssuer.redact(token));
        }
        return mapper.toPublicFormView(invitation);
    }

    private FormInvitation persistPending(final RecruiterContext recruiter, final IssueTarget target) {
        try {
            return writeTx.execute(status -> {
                final OffsetDateTime now = utcNow(clock);
                ensureNoActive(target.application().getId(), target.formId(), now, true);

                final FormInvitation invitation = new FormInvitation();
                invitation.setId(UUID.randomUUID());
                invitation.setOrganizationId(recruiter.organizationId());
                invitation.setApplicationId(target.application().getId());
                invitation.setFormId(target.formId());
                invitation.setToken(tokenIssuer.issue());
                invitation.setExpiresAt(now.plus(formsProperties.getInvitation().getTtl()));
                invitation.setSentBy(recruiter.recruiterId());
                invitation.setFieldSnapshot(target.snapshot());
                invitation.setCustomMessage(blankToNull(target.customMessage()));
                invitation.setCreatedAt(now);
                return formInvitationRepository.saveAndFlush(invitation);
            });
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent issue for application={} form={} rejected by unique index",
                    target.application().getId(), target.formId());
            throw new DuplicateActiveInvitationException(null);
        }
    }

    private FormInvitation deliver(final FormInvitation pending, final CandidateApplication application, final boolean reminder) {
        final DeliveryResult result = send(pending, application, reminder);
        final FormInvitation updated = writeTx.execute(status -> {
            final FormInvitation current = formInvitationRepository.findById(pending.getId())
                    .orElseThrow(() -> new IllegalStateException("Invitation vanished: " + pending.getId()));
            final OffsetDateTime now = utcNow(clock);
            if (result.success()) {
                current.transitionTo(InvitationStatus.SENT, now);
            } else {
                current.transitionTo(InvitationStatus.FAILED, now);
                current.setErrorMessage(truncate(result.error()));
            }
            return formInvitationRepository.save(current);
        });
        log.info("Invitation id={} application={} form={} status={} token={}", updated.getId(), updated.getApplicationId(),
                updated.getFormId(), updated.getStatus(), TokenIssuer.redact(updated.getToken()));
        return updated;
    }

    private DeliveryResult send(final FormInvitation invitation, final CandidateApplication application, final boolean reminder) {
        final InvitationEmail email = new InvitationEmail(
                application.getCandidateEmail(),
                application.getCandidateName(),
                invitation.getFieldSnapshot().formName(),
                formsProperties.invitationLink(invitation.getToken()),
                invitation.getCustomMessage(),
                invitation.getExpiresAt(),
                reminder);
        try {
            return invitationMailer.send(email);
        } catch (RuntimeException e) {
            log.warn("Mailer threw for invitation id={}: {}", invitation.getId(), e.getMessage(), e);
            return DeliveryResult.failed(e.getMessage());
        }
    }

    /**
     * Throws when a live invitation already covers the pair. An overdue one that the sweep has not
     * reached yet does not count; with {@code expireOverdue} it is expired on the spot.
     */
    private void ensureNoActive(final UUID applicationId, final UUID formId, final OffsetDateTime now, final boolean expireOverdue) {
        final Optional<FormInvitation> existing = formInvitationRepository
                .findFirstByApplicationIdAndFormIdAndStatusIn(applicationId, formId, InvitationStatus.ACTIVE);
        if (existing.isEmpty()) {
            return;
        }
        final FormInvitation invitation = existing.get();
        if (!invitation.isPastExpiry(now)) {
            throw new DuplicateActiveInvitationException(invitation.getId());
        }
        if (expireOverdue) {
            invitation.transitionTo(InvitationStatus.EXPIRED, now);
            formInvitationRepository.saveAndFlush(invitation);
        }
    }

    private Optional<FormInvitation> findBlockingActive(final UUID applicationId, final UUID formId, final OffsetDateTime now) {
        return formInvitationRepository
                .findFirstByApplicationIdAndFormIdAndStatusIn(applicationId, formId, InvitationStatus.ACTIVE)
                .filter(invitation -> !invitation.isPastExpiry(now));
    }

    private CandidateApplication requireApplication(final RecruiterContext recruiter, final UUID applicationId) {
        return candidateApplicationRepository.findById(applicationId)
                .filter(application -> application.getOrganizationId().equals(recruiter.organizationId()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Application not found: " + applicationId));
    }

    private FormInvitation requireInvitation(final RecruiterContext recruiter, final UUID invitationId) {
        return formInvitationRepository.findByIdAndOrganizationId(invitationId, recruiter.organizationId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Invitation not found: " + invitationId));
    }

    private static String truncate(final String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }

    private static String blankToNull(final String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

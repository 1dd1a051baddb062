package io.hireflow.forms;

import io.hireflow.forms.domain.CandidateApplication;
import io.hireflow.forms.domain.FieldType;
import io.hireflow.forms.domain.FormField;
import io.hireflow.forms.domain.FormInvitation;
import io.hireflow.forms.domain.FormSnapshot;
import io.hireflow.forms.domain.FormSnapshot.SnapshotField;
import io.hireflow.forms.domain.FormTemplate;
import io.hireflow.forms.domain.InvitationStatus;
import io.hireflow.forms.model.RecruiterContext;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Shared builders for unit tests.
 */
public final class TestFixtures {

    public static final Instant NOW_INSTANT = Instant.parse("2025-06-01T10:00:00Z");
    public static final OffsetDateTime NOW = OffsetDateTime.ofInstant(NOW_INSTANT, ZoneOffset.UTC);
    public static final Clock CLOCK = Clock.fixed(NOW_INSTANT, ZoneOffset.UTC);

    public static final UUID ORG = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    public static final UUID OTHER_ORG = UUID.fromString("00000000-0000-0000-0000-00000000000b");
    public static final UUID RECRUITER = UUID.fromString("00000000-0000-0000-0000-0000000000c1");

    public static final UUID NAME_FIELD = UUID.fromString("10000000-0000-0000-0000-000000000001");
    public static final UUID CHOICE_FIELD = UUID.fromString("10000000-0000-0000-0000-000000000002");
    public static final UUID CV_FIELD = UUID.fromString("10000000-0000-0000-0000-000000000003");

    private TestFixtures() {
    }

    public static RecruiterContext recruiter() {
        return new RecruiterContext(RECRUITER, ORG);
    }

    public static CandidateApplication application(final UUID id, final UUID organizationId, final String status) {
        final CandidateApplication application = new CandidateApplication();
        application.setId(id);
        application.setOrganizationId(organizationId);
        application.setCandidateName("Ada Lovelace");
        application.setCandidateEmail("ada@example.com");
        application.setStatus(status);
        return application;
    }

    /**
     * Short text (required), select A/B (required), file (optional).
     */
    public static FormSnapshot snapshot() {
        return new FormSnapshot("Screening", "A few questions", List.of(
                new SnapshotField(NAME_FIELD, FieldType.SHORT_TEXT, "Your name", true, List.of(), 0),
                new SnapshotField(CHOICE_FIELD, FieldType.SELECT, "Pick one", true, List.of("A", "B"), 1),
                new SnapshotField(CV_FIELD, FieldType.FILE, "Your CV", false, List.of(), 2)));
    }

    public static FormTemplate template(final UUID id, final UUID createdBy, final boolean published) {
        final FormTemplate template = new FormTemplate();
        template.setId(id);
        template.setOrganizationId(ORG);
        template.setCreatedBy(createdBy);
        template.setName("Screening");
        template.setDescription("A few questions");
        template.setPublished(published);
        template.setCreatedAt(NOW);
        template.setUpdatedAt(NOW);
        final FormField field = new FormField();
        field.setId(NAME_FIELD);
        field.setType(FieldType.SHORT_TEXT);
        field.setLabel("Your name");
        field.setRequired(true);
        field.setPosition(0);
        template.addField(field);
        return template;
    }

    public static FormInvitation invitation(final InvitationStatus status, final OffsetDateTime expiresAt) {
        final FormInvitation invitation = new FormInvitation();
        invitation.setId(UUID.randomUUID());
        invitation.setOrganizationId(ORG);
        invitation.setApplicationId(UUID.randomUUID());
        invitation.setFormId(UUID.randomUUID());
        invitation.setToken("abcdefghijABCDEFGHIJ0123456789_-abcdefghijk");
        invitation.setExpiresAt(expiresAt);
        invitation.setSentBy(RECRUITER);
        invitation.setFieldSnapshot(snapshot());
        invitation.setCreatedAt(NOW.minusDays(1));
        moveTo(invitation, status);
        return invitation;
    }

    /**
     * Walks the legal path from pending to {@code status}.
     */
    public static void moveTo(final FormInvitation invitation, final InvitationStatus status) {
        final OffsetDateTime at = NOW.minusHours(1);
        switch (status) {
            case PENDING -> {
            }
            case SENT -> invitation.transitionTo(InvitationStatus.SENT, at);
            case VIEWED -> {
                invitation.transitionTo(InvitationStatus.SENT, at);
                invitation.transitionTo(InvitationStatus.VIEWED, at);
            }
            case ANSWERED -> {
                invitation.transitionTo(InvitationStatus.SENT, at);
                invitation.transitionTo(InvitationStatus.ANSWERED, at);
            }
            case EXPIRED -> invitation.transitionTo(InvitationStatus.EXPIRED, at);
            case FAILED -> invitation.transitionTo(InvitationStatus.FAILED, at);
            default -> throw new IllegalArgumentException(status.name());
        }
    }
}

package io.hireflow.forms.repo;

import static io.hireflow.forms.TestFixtures.NOW;
import static io.hireflow.forms.TestFixtures.ORG;
import static io.hireflow.forms.TestFixtures.RECRUITER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.hireflow.forms.TestFixtures;
import io.hireflow.forms.domain.FormInvitation;
import io.hireflow.forms.domain.InvitationStatus;
import io.hireflow.forms.token.TokenIssuer;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase.Replace;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@DataJpaTest(
        properties = {
                "spring.jpa.hibernate.ddl-auto=none",
                "spring.flyway.enabled=true",
                "spring.jpa.properties.hibernate.connection.provider_disables_autocommit=false"
        }
)
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = Replace.NONE)
@DisplayName("FormInvitationRepository against PostgreSQL")
class FormInvitationRepositoryTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES =
            new PostgreSQLContainer<>("postgres:16-alpine")
                    .withDatabaseName("forms")
                    .withUsername("postgres")
                    .withPassword("postgres");

    @jakarta.annotation.Resource
    private FormInvitationRepository repo;
    @jakarta.annotation.Resource
    private JdbcTemplate jdbc;
    @PersistenceContext
    private EntityManager em;

    private final TokenIssuer tokens = new TokenIssuer(null);
    private UUID formId;
    private UUID applicationId;

    @DynamicPropertySource
    static void dbProps(final DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);
        r.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @BeforeEach
    void seed() {
        formId = UUID.randomUUID();
        applicationId = UUID.randomUUID();
        jdbc.update("INSERT INTO forms (id, organization_id, created_by, name, created_at, updated_at) "
                + "VALUES (?, ?, ?, 'Screening', now(), now())", formId, ORG, RECRUITER);
        jdbc.update("INSERT INTO applications (id, organization_id, candidate_name, candidate_email, status) "
                + "VALUES (?, ?, 'Ada Lovelace', 'ada@example.com', 'active')", applicationId, ORG);
    }

    private FormInvitation invitation(final InvitationStatus status, final OffsetDateTime expiresAt) {
        final FormInvitation invitation = TestFixtures.invitation(status, expiresAt);
        invitation.setApplicationId(applicationId);
        invitation.setFormId(formId);
        invitation.setToken(tokens.issue());
        return invitation;
    }

    @Test
    @DisplayName("snapshot and status survive a round trip through the database")
    void persistsSnapshot() {
        final FormInvitation saved = repo.saveAndFlush(invitation(InvitationStatus.SENT, NOW.plusDays(14)));
        em.clear();

        final FormInvitation loaded = repo.findByToken(saved.getToken()).orElseThrow();

        assertThat(loaded.getStatus()).isEqualTo(InvitationStatus.SENT);
        assertThat(loaded.getFieldSnapshot()).isEqualTo(TestFixtures.snapshot());
        assertThat(loaded.getExpiresAt().toInstant()).isEqualTo(NOW.plusDays(14).toInstant());
        assertThat(loaded.getVersion()).isZero();
    }

    @Test
    @DisplayName("only one active invitation per application and form")
    void oneActivePerPair() {
        repo.saveAndFlush(invitation(InvitationStatus.SENT, NOW.plusDays(14)));

        assertThatThrownBy(() -> repo.saveAndFlush(invitation(InvitationStatus.PENDING, NOW.plusDays(14))))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("finished invitations do not block a new one")
    void finishedDoNotBlock() {
        repo.saveAndFlush(invitation(InvitationStatus.EXPIRED, NOW.minusDays(1)));
        repo.saveAndFlush(invitation(InvitationStatus.ANSWERED, NOW.plusDays(3)));
        repo.saveAndFlush(invitation(InvitationStatus.FAILED, NOW.plusDays(3)));

        final FormInvitation active = repo.saveAndFlush(invitation(InvitationStatus.PENDING, NOW.plusDays(14)));

        assertThat(repo.findFirstByApplicationIdAndFormIdAndStatusIn(applicationId, formId, InvitationStatus.ACTIVE))
                .map(FormInvitation::getId)
                .contains(active.getId());
        assertThat(repo.findByApplicationIdAndOrganizationIdOrderByCreatedAtDesc(applicationId, ORG)).hasSize(4);
    }

    @Test
    @DisplayName("expireOverdue moves only overdue active rows and bumps their version")
    void expiresOverdue() {
        final FormInvitation overdue = repo.saveAndFlush(invitation(InvitationStatus.VIEWED, NOW.minusMinutes(1)));
        final FormInvitation answered = repo.saveAndFlush(invitation(InvitationStatus.ANSWERED, NOW.minusMinutes(1)));

        final UUID otherApplication = UUID.randomUUID();
        final FormInvitation current = invitation(InvitationStatus.SENT, NOW.plusDays(1));
        current.setApplicationId(otherApplication);
        repo.saveAndFlush(current);

        final int updated = repo.expireOverdue(InvitationStatus.EXPIRED, InvitationStatus.ACTIVE, NOW);

        assertThat(updated).isEqualTo(1);
        final FormInvitation reloaded = repo.findById(overdue.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(InvitationStatus.EXPIRED);
        assertThat(reloaded.getVersion()).isEqualTo(1L);
        assertThat(repo.findById(answered.getId()).orElseThrow().getStatus()).isEqualTo(InvitationStatus.ANSWERED);
        assertThat(repo.findById(current.getId()).orElseThrow().getStatus()).isEqualTo(InvitationStatus.SENT);
    }

    @Test
    @DisplayName("the sweep and on-access checks agree on the expiry instant")
    void sweepBoundaryMatchesAccessCheck() {
        final FormInvitation atInstant = repo.saveAndFlush(invitation(InvitationStatus.SENT, NOW));

        assertThat(repo.expireOverdue(InvitationStatus.EXPIRED, InvitationStatus.ACTIVE, NOW)).isZero();
        assertThat(atInstant.isPastExpiry(NOW)).isFalse();

        final OffsetDateTime later = NOW.plusSeconds(1);
        assertThat(atInstant.isPastExpiry(later)).isTrue();
        assertThat(repo.expireOverdue(InvitationStatus.EXPIRED, InvitationStatus.ACTIVE, later)).isEqualTo(1);
    }
}

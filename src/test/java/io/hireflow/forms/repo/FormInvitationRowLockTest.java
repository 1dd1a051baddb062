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

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase.Replace;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@DataJpaTest(
        properties = {
                "spring.jpa.hibernate.ddl-auto=none",
                "spring.flyway.enabled=true"
        }
)
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("FormInvitationRepository row locking against PostgreSQL")
class FormInvitationRowLockTest {

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
    @jakarta.annotation.Resource
    private PlatformTransactionManager transactionManager;

    private final ExecutorService pool = Executors.newFixedThreadPool(2);

    @DynamicPropertySource
    static void dbProps(final DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);
        r.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("a second open of the same link waits for the first and then sees it viewed")
    void overlappingOpensAreSerialized() throws Exception {
        final FormInvitation sent = repo.saveAndFlush(sentInvitation());
        final TransactionTemplate tx = new TransactionTemplate(transactionManager);
        final CountDownLatch firstHoldsLock = new CountDownLatch(1);
        final CountDownLatch releaseFirst = new CountDownLatch(1);

        final Future<InvitationStatus> first = pool.submit(() -> tx.execute(status -> {
            final FormInvitation invitation = repo.findByTokenForUpdate(sent.getToken()).orElseThrow();
            firstHoldsLock.countDown();
            await(releaseFirst);
            invitation.transitionTo(InvitationStatus.VIEWED, NOW);
            repo.save(invitation);
            return invitation.getStatus();
        }));
        assertThat(firstHoldsLock.await(10, TimeUnit.SECONDS)).isTrue();

        final Future<InvitationStatus> second = pool.submit(() -> tx.execute(status ->
                repo.findByTokenForUpdate(sent.getToken()).orElseThrow().getStatus()));

        assertThatThrownBy(() -> second.get(500, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);
        releaseFirst.countDown();

        assertThat(first.get(10, TimeUnit.SECONDS)).isEqualTo(InvitationStatus.VIEWED);
        assertThat(second.get(10, TimeUnit.SECONDS)).isEqualTo(InvitationStatus.VIEWED);
        assertThat(repo.findById(sent.getId()).orElseThrow().getVersion()).isEqualTo(1L);
    }

    private FormInvitation sentInvitation() {
        final UUID formId = UUID.randomUUID();
        final UUID applicationId = UUID.randomUUID();
        jdbc.update("INSERT INTO forms (id, organization_id, created_by, name, created_at, updated_at) "
                + "VALUES (?, ?, ?, 'Screening', now(), now())", formId, ORG, RECRUITER);
        jdbc.update("INSERT INTO applications (id, organization_id, candidate_name, candidate_email, status) "
                + "VALUES (?, ?, 'Ada Lovelace', 'ada@example.com', 'active')", applicationId, ORG);

        final FormInvitation invitation = TestFixtures.invitation(InvitationStatus.SENT, NOW.plusDays(14));
        invitation.setApplicationId(applicationId);
        invitation.setFormId(formId);
        invitation.setToken(new TokenIssuer(null).issue());
        return invitation;
    }

    private static void await(final CountDownLatch latch) {
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}

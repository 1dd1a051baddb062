package io.hireflow.forms.quota;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase.Replace;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@JdbcTest(properties = "spring.flyway.enabled=true")
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("JdbcQuotaStore against PostgreSQL")
class JdbcQuotaStoreTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES =
            new PostgreSQLContainer<>("postgres:16-alpine")
                    .withDatabaseName("forms")
                    .withUsername("postgres")
                    .withPassword("postgres");

    private static final LocalDate DAY = LocalDate.of(2025, 6, 1);

    @jakarta.annotation.Resource
    private DataSource dataSource;

    private JdbcQuotaStore store;
    private UUID recruiter;

    @DynamicPropertySource
    static void dbProps(final DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);
        r.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @BeforeEach
    void setUp() {
        store = new JdbcQuotaStore(new NamedParameterJdbcTemplate(dataSource));
        recruiter = UUID.randomUUID();
    }

    @Test
    @DisplayName("upsert grants until the ceiling and keeps kinds and days apart")
    void grantsUntilCeiling() {
        assertThat(store.used(recruiter, DAY, CounterKind.INVITATIONS_SENT)).isZero();
        assertThat(store.tryIncrement(recruiter, DAY, CounterKind.INVITATIONS_SENT, 2)).hasValue(1);
        assertThat(store.tryIncrement(recruiter, DAY, CounterKind.INVITATIONS_SENT, 2)).hasValue(2);
        assertThat(store.tryIncrement(recruiter, DAY, CounterKind.INVITATIONS_SENT, 2)).isEmpty();

        assertThat(store.tryIncrement(recruiter, DAY, CounterKind.AI_SUGGESTIONS, 2)).hasValue(1);
        assertThat(store.tryIncrement(recruiter, DAY.plusDays(1), CounterKind.INVITATIONS_SENT, 2)).hasValue(1);
        assertThat(store.used(recruiter, DAY, CounterKind.INVITATIONS_SENT)).isEqualTo(2);
    }

    @Test
    @DisplayName("exactly limit callers succeed across connections")
    void concurrentCallers() throws Exception {
        final int limit = 10;
        final ExecutorService pool = Executors.newFixedThreadPool(8);
        final CountDownLatch start = new CountDownLatch(1);
        try {
            final List<Future<OptionalInt>> results = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return store.tryIncrement(recruiter, DAY, CounterKind.INVITATIONS_SENT, limit);
                }));
            }
            start.countDown();

            int granted = 0;
            for (final Future<OptionalInt> result : results) {
                if (result.get(30, TimeUnit.SECONDS).isPresent()) {
                    granted++;
                }
            }
            assertThat(granted).isEqualTo(limit);
            assertThat(store.used(recruiter, DAY, CounterKind.INVITATIONS_SENT)).isEqualTo(limit);
        } finally {
            pool.shutdownNow();
        }
    }
}

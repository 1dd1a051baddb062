package io.hireflow.forms.repo;

import io.hireflow.forms.domain.FormResponse;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.hibernate.jpa.HibernateHints;
import org.springframework.stereotype.Repository;

/**
 * Imperative repository for the export stream. Only the filters that are present end up in the
 * JPQL, so no untyped null parameters reach PostgreSQL.
 */
@Repository
public class ResponseExportRepository {

    private static final int FETCH_SIZE = 200;

    @PersistenceContext
    private EntityManager entityManager;

    /**
     * Streams matching responses oldest first. Must be consumed inside an open transaction and closed
     * by the caller.
     */
    public Stream<FormResponse> stream(final UUID organizationId,
                                       final UUID formId,
                                       final UUID applicationId,
                                       final OffsetDateTime from,
                                       final OffsetDateTime to) {
        final StringBuilder jpql = new StringBuilder("SELECT r FROM FormResponse r WHERE r.organizationId = :organizationId");
        final Map<String, Object> params = new LinkedHashMap<>();
        params.put("organizationId", organizationId);
        if (formId != null) {
            jpql.append(" AND r.formId = :formId");
            params.put("formId", formId);
        }
        if (applicationId != null) {
            jpql.append(" AND r.applicationId = :applicationId");
            params.put("applicationId", applicationId);
        }
        if (from != null) {
            jpql.append(" AND r.submittedAt >= :from");
            params.put("from", from);
        }
        if (to != null) {
            jpql.append(" AND r.submittedAt < :to");
            params.put("to", to);
        }
        jpql.append(" ORDER BY r.submittedAt ASC, r.id ASC");

        final TypedQuery<FormResponse> query = entityManager.createQuery(jpql.toString(), FormResponse.class);
        params.forEach(query::setParameter);
        query.setHint(HibernateHints.HINT_FETCH_SIZE, FETCH_SIZE);
        query.setHint(HibernateHints.HINT_READ_ONLY, true);
        return query.getResultStream();
    }
}

package io.hireflow.forms.services;

import io.hireflow.forms.domain.FormResponse;
import io.hireflow.forms.model.ExportFilter;
import io.hireflow.forms.model.ExportRow;
import io.hireflow.forms.model.RecruiterContext;
import io.hireflow.forms.repo.ResponseExportRepository;
import io.hireflow.forms.services.mapper.FormsMapper;

import java.util.function.Consumer;
import java.util.stream.Stream;

import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Flattens submitted responses for export. Question text and field types come from the rows copied
 * at submit time, so later template edits or deletion do not change an export.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class ExportService {

    private final ResponseExportRepository responseExportRepository;
    private final FormsMapper mapper;
    private final EntityManager entityManager;

    public ExportService(
            final ResponseExportRepository responseExportRepository,
            final FormsMapper mapper,
            final EntityManager entityManager
    ) {
        this.responseExportRepository = responseExportRepository;
        this.mapper = mapper;
        this.entityManager = entityManager;
    }

    /**
     * Lazy row stream. The caller must already be in a transaction and must close the stream.
     */
    @Transactional(readOnly = true, propagation = Propagation.MANDATORY)
    public Stream<ExportRow> stream(final RecruiterContext recruiter, final ExportFilter filter) {
        final Stream<FormResponse> responses = responseExportRepository.stream(
                recruiter.organizationId(), filter.formId(), filter.applicationId(), filter.from(), filter.to());
        return responses.map(response -> {
            final ExportRow row = mapper.toExportRow(response);
            // keep the persistence context from growing with every streamed row
            entityManager.detach(response);
            return row;
        });
    }

    /**
     * Pushes every matching row to {@code sink} inside one read-only transaction.
     *
     * @return number of rows written
     */
    public long exportTo(final RecruiterContext recruiter, final ExportFilter filter, final Consumer<ExportRow> sink) {
        long count = 0;
        try (Stream<ExportRow> rows = stream(recruiter, filter)) {
            for (final ExportRow row : (Iterable<ExportRow>) rows::iterator) {
                sink.accept(row);
                count++;
            }
        }
        log.info("Exported {} responses org={} filter={}", Long.valueOf(count), recruiter.organizationId(), filter);
        return count;
    }
}

package io.hireflow.forms.services;

import io.hireflow.forms.clients.ai.FieldDraft;
import io.hireflow.forms.clients.ai.FieldSuggestionClient;
import io.hireflow.forms.clients.ai.FieldSuggestionClientProperties;
import io.hireflow.forms.clients.ai.FieldSuggestions;
import io.hireflow.forms.clients.ai.SuggestionContext;
import io.hireflow.forms.config.FormsProperties;
import io.hireflow.forms.errors.FormValidationException;
import io.hireflow.forms.model.FieldRequest;
import io.hireflow.forms.model.FieldResponse;
import io.hireflow.forms.model.RecruiterContext;
import io.hireflow.forms.model.SuggestRequest;
import io.hireflow.forms.model.SuggestResponse;
import io.hireflow.forms.quota.CounterKind;
import io.hireflow.forms.quota.QuotaLedger;
import io.hireflow.forms.services.TemplateValidator.ValidField;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

/**
 * Asks the suggestion service for question drafts. Nothing is persisted; the editor appends the
 * returned drafts to a template like hand-written fields.
 */
@Slf4j
@Service
public class FieldSuggestionService {

    private final Optional<FieldSuggestionClient> fieldSuggestionClient;
    private final FieldSuggestionClientProperties clientProperties;
    private final QuotaLedger quotaLedger;
    private final TemplateValidator templateValidator;
    private final FormsProperties formsProperties;

    public FieldSuggestionService(
            final Optional<FieldSuggestionClient> fieldSuggestionClient,
            final FieldSuggestionClientProperties clientProperties,
            final QuotaLedger quotaLedger,
            final TemplateValidator templateValidator,
            final FormsProperties formsProperties
    ) {
        this.fieldSuggestionClient = fieldSuggestionClient;
        this.clientProperties = clientProperties;
        this.quotaLedger = quotaLedger;
        this.templateValidator = templateValidator;
        this.formsProperties = formsProperties;
    }

    public SuggestResponse suggest(final RecruiterContext recruiter, final SuggestRequest request) {
        if (!clientProperties.isEnabled() || fieldSuggestionClient.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "AI suggestions are not enabled");
        }
        if (!StringUtils.hasText(request.jobDescription())) {
            throw new FormValidationException("jobDescription", "A job description is required for suggestions");
        }

        quotaLedger.consumeOrThrow(recruiter.recruiterId(), CounterKind.AI_SUGGESTIONS);

        final FieldSuggestions suggestions = fieldSuggestionClient.get().suggest(
                new SuggestionContext(request.jobId(), request.jobDescription().trim(), request.goals()));

        final int maxFields = formsProperties.getTemplate().getMaxFields();
        final List<FieldResponse> accepted = new ArrayList<>();
        int discarded = 0;
        for (final FieldDraft draft : suggestions.fields()) {
            final FieldRequest candidate = draft == null
                    ? null
                    : new FieldRequest(draft.type(), draft.label(), draft.required(), draft.options());
            if (accepted.size() >= maxFields || !templateValidator.checkField(candidate).isEmpty()) {
                discarded++;
                continue;
            }
            final ValidField valid = templateValidator.toValid(candidate, accepted.size());
            accepted.add(new FieldResponse(UUID.randomUUID(), valid.type(), valid.label(), valid.required(),
                    valid.options(), valid.order()));
        }

        log.info("AI suggestions recruiter={} accepted={} discarded={} model={}", recruiter.recruiterId(),
                Integer.valueOf(accepted.size()), Integer.valueOf(discarded), suggestions.modelVersion());
        return new SuggestResponse(accepted, suggestions.modelVersion(), discarded);
    }
}

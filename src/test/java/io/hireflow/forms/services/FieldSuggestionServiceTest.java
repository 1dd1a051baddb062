package io.hireflow.forms.services;

import static io.hireflow.forms.TestFixtures.RECRUITER;
import static io.hireflow.forms.TestFixtures.recruiter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.hireflow.forms.clients.ai.FieldDraft;
import io.hireflow.forms.clients.ai.FieldSuggestionClient;
import io.hireflow.forms.clients.ai.FieldSuggestionClientProperties;
import io.hireflow.forms.clients.ai.FieldSuggestions;
import io.hireflow.forms.config.FormsProperties;
import io.hireflow.forms.domain.FieldType;
import io.hireflow.forms.errors.FormValidationException;
import io.hireflow.forms.model.FieldResponse;
import io.hireflow.forms.model.SuggestRequest;
import io.hireflow.forms.model.SuggestResponse;
import io.hireflow.forms.quota.CounterKind;
import io.hireflow.forms.quota.QuotaLedger;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

@DisplayName("FieldSuggestionService")
@ExtendWith(MockitoExtension.class)
class FieldSuggestionServiceTest {

    @Mock
    private FieldSuggestionClient client;
    @Mock
    private QuotaLedger quotaLedger;

    private FieldSuggestionClientProperties props;
    private FormsProperties formsProperties;

    @BeforeEach
    void setUp() {
        props = new FieldSuggestionClientProperties();
        props.setEnabled(true);
        formsProperties = new FormsProperties();
    }

    private FieldSuggestionService service(final Optional<FieldSuggestionClient> maybeClient) {
        return new FieldSuggestionService(maybeClient, props, quotaLedger,
                new TemplateValidator(formsProperties), formsProperties);
    }

    @Test
    @DisplayName("invalid drafts are dropped and the rest get dense order")
    void filtersDrafts() {
        when(client.suggest(any())).thenReturn(new FieldSuggestions(List.of(
                new FieldDraft("short_text", "Years of Java?", true, null),
                new FieldDraft("select", "Preferred stack", null, List.of()),
                new FieldDraft("hologram", "Beam me up", true, null),
                new FieldDraft("select", "Notice period", false, List.of("None", "1 month"))), "m-1"));

        final SuggestResponse response = service(Optional.of(client))
                .suggest(recruiter(), new SuggestRequest(null, "Senior Java engineer", List.of("screen for Java")));

        assertThat(response.fields()).extracting(FieldResponse::label).containsExactly("Years of Java?", "Notice period");
        assertThat(response.fields()).extracting(FieldResponse::order).containsExactly(0, 1);
        assertThat(response.fields().get(1).type()).isEqualTo(FieldType.SELECT);
        assertThat(response.discarded()).isEqualTo(2);
        assertThat(response.modelVersion()).isEqualTo("m-1");
        verify(quotaLedger).consumeOrThrow(RECRUITER, CounterKind.AI_SUGGESTIONS);
    }

    @Test
    @DisplayName("drafts beyond the field limit are discarded")
    void capsAtFieldLimit() {
        formsProperties.getTemplate().setMaxFields(1);
        when(client.suggest(any())).thenReturn(new FieldSuggestions(List.of(
                new FieldDraft("short_text", "One", true, null),
                new FieldDraft("short_text", "Two", true, null)), null));

        final SuggestResponse response = service(Optional.of(client))
                .suggest(recruiter(), new SuggestRequest(null, "Job", null));

        assertThat(response.fields()).hasSize(1);
        assertThat(response.discarded()).isEqualTo(1);
    }

    @Test
    @DisplayName("disabled suggestions fail before any quota is consumed")
    void disabled() {
        props.setEnabled(false);

        assertThatThrownBy(() -> service(Optional.of(client)).suggest(recruiter(), new SuggestRequest(null, "Job", null)))
                .isInstanceOfSatisfying(ResponseStatusException.class, e ->
                        assertThat(e.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE));
        verifyNoInteractions(quotaLedger, client);
    }

    @Test
    @DisplayName("a job description is required")
    void requiresDescription() {
        assertThatThrownBy(() -> service(Optional.of(client)).suggest(recruiter(), new SuggestRequest(null, " ", null)))
                .isInstanceOf(FormValidationException.class);
        verify(quotaLedger, never()).consumeOrThrow(any(), any());
    }
}

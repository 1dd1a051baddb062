package io.hireflow.forms.clients.ai;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Calls the upstream suggestion endpoint and hands back whatever drafts it produced.
 */
@Slf4j
@RequiredArgsConstructor
public class RestFieldSuggestionClient implements FieldSuggestionClient {

    private final RestClient suggestionRestClient;
    private final FieldSuggestionClientProperties props;

    @Override
    public FieldSuggestions suggest(final SuggestionContext context) {
        try {
            final FieldSuggestions resp = suggestionRestClient
                    .post()
                    .uri(props.getPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(context)
                    .retrieve()
                    .body(FieldSuggestions.class);
            return resp == null ? new FieldSuggestions(null, null) : resp;

        } catch (HttpStatusCodeException ex) {
            final String body = Optional.ofNullable(ex.getResponseBodyAsString(StandardCharsets.UTF_8)).orElse("");
            final String msg = "Suggestion API error: %d %s - %s".formatted(ex.getStatusCode().value(), ex.getStatusText(), body);
            log.warn(msg);
            throw new FieldSuggestionClientException(msg, ex);

        } catch (RestClientException ex) {
            final String msg = "Failed to call suggestion API";
            log.error(msg, ex);
            throw new FieldSuggestionClientException(msg, ex);
        }
    }
}

package io.hireflow.forms.model;

import java.time.OffsetDateTime;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error,
                            String code,
                            String message,
                            OffsetDateTime timestamp,
                            String traceId,
                            Map<String, Object> details) {

    public ErrorResponse withDetails(final Map<String, Object> extra) {
        return new ErrorResponse(error, code, message, timestamp, traceId,
                extra == null || extra.isEmpty() ? null : extra);
    }
}

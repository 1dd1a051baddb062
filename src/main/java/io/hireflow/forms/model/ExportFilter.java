package io.hireflow.forms.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ExportFilter(UUID formId, UUID applicationId, OffsetDateTime from, OffsetDateTime to) {
}

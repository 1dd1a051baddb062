package io.hireflow.forms.services;

import io.hireflow.forms.domain.FieldType;
import io.hireflow.forms.domain.FormSnapshot;
import io.hireflow.forms.domain.FormSnapshot.SnapshotField;
import io.hireflow.forms.errors.FormValidationException;
import io.hireflow.forms.errors.MissingRequiredAnswerException;
import io.hireflow.forms.model.AnswerRequest;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Checks candidate answers against the frozen snapshot and normalises them.
 */
@Component
public class AnswerValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Set<String> YES = Set.of("yes", "true", "1");
    private static final Set<String> NO = Set.of("no", "false", "0");

    public record ValidAnswer(String answer, String fileUrl) {

        boolean isBlank() {
            return (answer == null || answer.isBlank()) && (fileUrl == null || fileUrl.isBlank());
        }
    }

    /**
     * Returns the accepted answers keyed by field id, in snapshot order. Fields the candidate left out are absent.
     *
     * @throws FormValidationException for unknown or duplicate fields and malformed values
     * @throws MissingRequiredAnswerException when required fields are blank
     */
    public Map<UUID, ValidAnswer> validate(final FormSnapshot snapshot, final List<AnswerRequest> answers) {
        final Map<String, String> errors = new LinkedHashMap<>();
        final Map<UUID, ValidAnswer> byField = new LinkedHashMap<>();

        for (int i = 0; i < answers.size(); i++) {
            final AnswerRequest request = answers.get(i);
            final String path = "answers[" + i + "]";
            final Optional<SnapshotField> field = snapshot.field(request.fieldId());
            if (field.isEmpty()) {
                errors.put(path + ".fieldId", "Unknown field " + request.fieldId());
                continue;
            }
            if (byField.containsKey(request.fieldId())) {
                errors.put(path + ".fieldId", "Field answered more than once");
                continue;
            }
            final ValidAnswer valid = check(field.get(), request, path, errors);
            if (valid != null) {
                byField.put(request.fieldId(), valid);
            }
        }
        if (!errors.isEmpty()) {
            throw new FormValidationException("Some answers are invalid", errors);
        }

        final List<UUID> missingIds = new ArrayList<>();
        final List<String> missingQuestions = new ArrayList<>();
        final Map<UUID, ValidAnswer> ordered = new LinkedHashMap<>();
        for (final SnapshotField field : snapshot.fields()) {
            final ValidAnswer valid = byField.get(field.id());
            if (field.required() && (valid == null || valid.isBlank())) {
                missingIds.add(field.id());
                missingQuestions.add(field.label());
            }
            if (valid != null) {
                ordered.put(field.id(), valid);
            }
        }
        if (!missingIds.isEmpty()) {
            throw new MissingRequiredAnswerException(missingIds, missingQuestions);
        }
        return ordered;
    }

    private ValidAnswer check(final SnapshotField field,
                              final AnswerRequest request,
                              final String path,
                              final Map<String, String> errors) {
        final String answer = trimToNull(request.answer());
        final String fileUrl = trimToNull(request.fileUrl());

        if (fileUrl != null && field.type() != FieldType.FILE) {
            errors.put(path + ".fileUrl", "Only file fields accept a file");
            return null;
        }
        if (fileUrl != null && answer != null) {
            errors.put(path, "Provide either an answer or a file, not both");
            return null;
        }
        if (answer == null) {
            return new ValidAnswer(null, fileUrl);
        }

        switch (field.type()) {
            case EMAIL -> {
                if (!EMAIL.matcher(answer).matches()) {
                    errors.put(path + ".answer", "Enter a valid email address");
                    return null;
                }
            }
            case SELECT -> {
                if (!field.options().contains(answer)) {
                    errors.put(path + ".answer", "Choose one of: " + String.join(", ", field.options()));
                    return null;
                }
            }
            case DATE -> {
                if (!isIsoDate(answer)) {
                    errors.put(path + ".answer", "Enter a date as yyyy-MM-dd");
                    return null;
                }
            }
            case YES_NO -> {
                final String normalised = answer.toLowerCase(Locale.ROOT);
                if (YES.contains(normalised)) {
                    return new ValidAnswer("yes", null);
                }
                if (NO.contains(normalised)) {
                    return new ValidAnswer("no", null);
                }
                errors.put(path + ".answer", "Answer yes or no");
                return null;
            }
            default -> {
                // free text and file fields take the value as given
            }
        }
        return new ValidAnswer(answer, null);
    }

    private static boolean isIsoDate(final String value) {
        try {
            LocalDate.parse(value);
            return true;
        } catch (DateTimeParseException e) {
            try {
                OffsetDateTime.parse(value);
                return true;
            } catch (DateTimeParseException ignored) {
                return false;
            }
        }
    }

    private static String trimToNull(final String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

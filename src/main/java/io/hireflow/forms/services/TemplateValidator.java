package io.hireflow.forms.services;

import io.hireflow.forms.config.FormsProperties;
import io.hireflow.forms.domain.FieldType;
import io.hireflow.forms.errors.FormValidationException;
import io.hireflow.forms.model.FieldRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Checks template metadata and field definitions. Errors are collected per path
 * ({@code name}, {@code fields[2].options}, ...) and reported together.
 */
@Component
public class TemplateValidator {

    private final FormsProperties formsProperties;

    public TemplateValidator(final FormsProperties formsProperties) {
        this.formsProperties = formsProperties;
    }

    /**
     * A field definition that passed validation, with options trimmed and order assigned.
     */
    public record ValidField(FieldType type, String label, boolean required, List<String> options, int order) {
    }

    public void validateName(final String name, final Map<String, String> errors) {
        if (!StringUtils.hasText(name)) {
            errors.put("name", "Form name is required");
        } else if (name.trim().length() > formsProperties.getTemplate().getMaxNameLength()) {
            errors.put("name", "Form name must be at most " + formsProperties.getTemplate().getMaxNameLength() + " characters");
        }
    }

    public void validateDescription(final String description, final Map<String, String> errors) {
        if (description != null && description.length() > formsProperties.getTemplate().getMaxDescriptionLength()) {
            errors.put("description", "Description must be at most "
                    + formsProperties.getTemplate().getMaxDescriptionLength() + " characters");
        }
    }

    public List<ValidField> validateFields(final List<FieldRequest> fields, final Map<String, String> errors) {
        if (fields == null || fields.isEmpty()) {
            errors.put("fields", "At least one field is required");
            return List.of();
        }
        final int maxFields = formsProperties.getTemplate().getMaxFields();
        if (fields.size() > maxFields) {
            errors.put("fields", "Field limit exceeded: at most " + maxFields + " fields are allowed");
            return List.of();
        }
        final List<ValidField> valid = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            final String prefix = "fields[" + i + "]";
            final Map<String, String> fieldErrors = checkField(fields.get(i));
            if (fieldErrors.isEmpty()) {
                valid.add(toValid(fields.get(i), i));
            } else {
                fieldErrors.forEach((path, message) -> errors.put(prefix + path, message));
            }
        }
        return valid;
    }

    /**
     * Validates a whole template and throws if anything is wrong.
     */
    public List<ValidField> validateTemplate(final String name, final String description, final List<FieldRequest> fields) {
        final Map<String, String> errors = new LinkedHashMap<>();
        validateName(name, errors);
        validateDescription(description, errors);
        final List<ValidField> valid = validateFields(fields, errors);
        throwIfAny(errors);
        return valid;
    }

    /**
     * Errors for a single field keyed by a path suffix ({@code ".label"}, {@code ".options"}); empty when valid.
     */
    public Map<String, String> checkField(final FieldRequest field) {
        final Map<String, String> errors = new LinkedHashMap<>();
        if (field == null) {
            errors.put("", "Field definition is required");
            return errors;
        }
        final FieldType type = FieldType.fromWire(field.type()).orElse(null);
        if (type == null) {
            errors.put(".type", "Unknown field type: " + field.type());
        }
        if (!StringUtils.hasText(field.label())) {
            errors.put(".label", "Field label is required");
        }
        final List<String> options = field.options() == null ? List.of() : field.options();
        if (type == FieldType.SELECT) {
            if (options.stream().noneMatch(StringUtils::hasText)) {
                errors.put(".options", "Select fields need at least one option");
            } else if (options.stream().anyMatch(option -> !StringUtils.hasText(option))) {
                errors.put(".options", "Select options must not be empty");
            }
        } else if (type != null && !options.isEmpty()) {
            errors.put(".options", "Only select fields may have options");
        }
        return errors;
    }

    public void throwIfAny(final Map<String, String> errors) {
        if (!errors.isEmpty()) {
            throw new FormValidationException("Form template is invalid", errors);
        }
    }

    ValidField toValid(final FieldRequest field, final int order) {
        final FieldType type = FieldType.of(field.type());
        final List<String> options = type == FieldType.SELECT
                ? field.options().stream().map(String::trim).toList()
                : List.of();
        return new ValidField(type, field.label().trim(), Boolean.TRUE.equals(field.required()), options, order);
    }
}

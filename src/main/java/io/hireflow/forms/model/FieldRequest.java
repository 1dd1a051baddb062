package io.hireflow.forms.model;

import java.util.List;

/**
 * A field as sent by the template editor. {@code type} stays a string so unknown values are
 * reported as a field-level validation error.
 */
public record FieldRequest(String type, String label, Boolean required, List<String> options) {
}

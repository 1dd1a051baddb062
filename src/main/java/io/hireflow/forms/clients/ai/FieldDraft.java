package io.hireflow.forms.clients.ai;

import java.util.List;

/**
 * One suggested question as returned by the suggestion service. Values are untrusted until validated.
 */
public record FieldDraft(String type, String label, Boolean required, List<String> options) {
}

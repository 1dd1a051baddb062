package io.hireflow.forms.model;

import java.util.UUID;

/**
 * Caller identity for recruiter endpoints, taken from the {@code X-Recruiter-Id} and
 * {@code X-Organization-Id} headers set by the upstream auth layer.
 */
public record RecruiterContext(UUID recruiterId, UUID organizationId) {
}

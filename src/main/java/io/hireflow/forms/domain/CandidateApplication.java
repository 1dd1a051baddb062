package io.hireflow.forms.domain;

import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

/**
 * Read-only view of the ATS application row: just enough to address the email and scope access.
 */
@Entity
@Immutable
@Table(name = "applications")
@Getter
@Setter
@NoArgsConstructor
@ToString
public class CandidateApplication {

    private static final Set<String> CLOSED_STATUSES = Set.of("rejected", "withdrawn");

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private UUID organizationId;

    @Column(name = "candidate_name", nullable = false)
    private String candidateName;

    @Column(name = "candidate_email", nullable = false)
    private String candidateEmail;

    @Column(name = "status", nullable = false)
    private String status;

    public boolean isClosed() {
        return status != null && CLOSED_STATUSES.contains(status.toLowerCase(Locale.ROOT));
    }
}

package io.hireflow.forms.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "form_responses")
@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = "answers")
public class FormResponse {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "invitation_id", nullable = false, unique = true)
    private UUID invitationId;

    @Column(name = "application_id", nullable = false)
    private UUID applicationId;

    @Column(name = "form_id", nullable = false)
    private UUID formId;

    @Column(name = "organization_id", nullable = false)
    private UUID organizationId;

    // copied from the invitation snapshot
    @Column(name = "form_name", nullable = false, length = 200)
    private String formName;

    @Column(name = "submitted_at", nullable = false)
    private OffsetDateTime submittedAt;

    @OneToMany(mappedBy = "response", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<FormResponseAnswer> answers = new ArrayList<>();

    @Version
    @Column(name = "version")
    private Long version;

    public void addAnswer(final FormResponseAnswer answer) {
        answer.setResponse(this);
        this.answers.add(answer);
    }
}

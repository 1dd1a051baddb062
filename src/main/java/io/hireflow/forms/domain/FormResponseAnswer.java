package io.hireflow.forms.domain;

import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "form_response_answers")
@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = "response")
public class FormResponseAnswer {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "response_id", nullable = false)
    private FormResponse response;

    @Column(name = "field_id", nullable = false)
    private UUID fieldId;

    @Column(name = "question", nullable = false, columnDefinition = "text")
    private String question;

    @Enumerated(EnumType.STRING)
    @Column(name = "field_type", nullable = false, length = 32)
    private FieldType fieldType;

    @Column(name = "answer", columnDefinition = "text")
    private String answer;

    @Column(name = "file_url", columnDefinition = "text")
    private String fileUrl;

    @Column(name = "position", nullable = false)
    private int position;
}

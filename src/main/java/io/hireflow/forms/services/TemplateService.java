package io.hireflow.forms.services;

import static io.hireflow.forms.util.TimeUtils.utcNow;

import io.hireflow.forms.domain.FieldType;
import io.hireflow.forms.domain.FormField;
import io.hireflow.forms.domain.FormTemplate;
import io.hireflow.forms.model.RecruiterContext;
import io.hireflow.forms.model.TemplateRequest;
import io.hireflow.forms.model.TemplateResponse;
import io.hireflow.forms.model.TemplateUpdateRequest;
import io.hireflow.forms.repo.FormInvitationRepository;
import io.hireflow.forms.repo.FormTemplateRepository;
import io.hireflow.forms.services.TemplateValidator.ValidField;
import io.hireflow.forms.services.mapper.FormsMapper;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@Service
@Transactional(readOnly = true)
public class TemplateService {

    private final FormTemplateRepository formTemplateRepository;
    private final FormInvitationRepository formInvitationRepository;
    private final TemplateValidator templateValidator;
    private final FormsMapper mapper;
    private final Clock clock;

    public TemplateService(
            final FormTemplateRepository formTemplateRepository,
            final FormInvitationRepository formInvitationRepository,
            final TemplateValidator templateValidator,
            final FormsMapper mapper,
            final Clock clock
    ) {
        this.formTemplateRepository = formTemplateRepository;
        this.formInvitationRepository = formInvitationRepository;
        this.templateValidator = templateValidator;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Transactional
    public TemplateResponse createTemplate(final RecruiterContext recruiter, final TemplateRequest request) {
        final List<ValidField> fields =
                templateValidator.validateTemplate(request.name(), request.description(), request.fields());
        final OffsetDateTime now = utcNow(clock);

        final FormTemplate template = new FormTemplate();
        template.setId(UUID.randomUUID());
        template.setOrganizationId(recruiter.organizationId());
        template.setCreatedBy(recruiter.recruiterId());
        template.setName(request.name().trim());
        template.setDescription(blankToNull(request.description()));
        template.setPublished(request.isPublished() == null || request.isPublished());
        template.setCreatedAt(now);
        template.setUpdatedAt(now);
        fields.forEach(field -> template.addField(newField(field)));

        final FormTemplate saved = formTemplateRepository.save(template);
        log.info("Created form template id={} fields={} org={}", saved.getId(),
                Integer.valueOf(saved.getFields().size()), recruiter.organizationId());
        return mapper.toTemplateResponse(saved);
    }

    @Transactional
    public TemplateResponse updateTemplate(final RecruiterContext recruiter, final UUID id, final TemplateUpdateRequest request) {
        final FormTemplate template = requireOwned(recruiter, id);

        final Map<String, String> errors = new LinkedHashMap<>();
        if (request.name() != null) {
            templateValidator.validateName(request.name(), errors);
        }
        if (request.description() != null) {
            templateValidator.validateDescription(request.description(), errors);
        }
        final List<ValidField> fields = request.fields() == null
                ? null
                : templateValidator.validateFields(request.fields(), errors);
        templateValidator.throwIfAny(errors);

        if (request.name() != null) {
            template.setName(request.name().trim());
        }
        if (request.description() != null) {
            template.setDescription(blankToNull(request.description()));
        }
        if (request.isPublished() != null) {
            template.setPublished(request.isPublished());
        }
        if (fields != null) {
            // old rows must be gone before the new ones are inserted at the same positions
            template.getFields().clear();
            formTemplateRepository.saveAndFlush(template);
            fields.forEach(field -> template.addField(newField(field)));
        }
        template.setUpdatedAt(utcNow(clock));

        final FormTemplate saved = formTemplateRepository.save(template);
        log.info("Updated form template id={} fieldsReplaced={}", saved.getId(), Boolean.valueOf(fields != null));
        return mapper.toTemplateResponse(saved);
    }

    public TemplateResponse getTemplate(final RecruiterContext recruiter, final UUID id) {
        return mapper.toTemplateResponse(requireVisible(recruiter, id));
    }

    public List<TemplateResponse> listTemplates(final RecruiterContext recruiter) {
        final List<TemplateResponse> result = new ArrayList<>();
        formTemplateRepository.findVisibleTo(recruiter.organizationId(), recruiter.recruiterId())
                .forEach(template -> result.add(mapper.toTemplateResponse(template)));
        return result;
    }

    /**
     * Deletes a template nobody has been invited to. Templates with invitations can only be unpublished.
     */
    @Transactional
    public void deleteTemplate(final RecruiterContext recruiter, final UUID id) {
        final FormTemplate template = requireOwned(recruiter, id);
        if (formInvitationRepository.existsByFormId(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Form has invitations and cannot be deleted; unpublish it instead");
        }
        formTemplateRepository.delete(template);
        log.info("Deleted form template id={}", id);
    }

    /**
     * Template in the caller's organization that the caller may use: published, or their own draft.
     */
    public FormTemplate requireVisible(final RecruiterContext recruiter, final UUID id) {
        return formTemplateRepository.findByIdAndOrganizationId(id, recruiter.organizationId())
                .filter(template -> template.isVisibleTo(recruiter.recruiterId()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Form template not found: " + id));
    }

    private FormTemplate requireOwned(final RecruiterContext recruiter, final UUID id) {
        final FormTemplate template = requireVisible(recruiter, id);
        if (!template.getCreatedBy().equals(recruiter.recruiterId())) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Only the creator can modify this form template");
        }
        return template;
    }

    private static FormField newField(final ValidField valid) {
        final FormField field = new FormField();
        field.setId(UUID.randomUUID());
        field.setType(valid.type());
        field.setLabel(valid.label());
        field.setRequired(valid.required());
        field.setOptions(valid.type() == FieldType.SELECT ? new ArrayList<>(valid.options()) : null);
        field.setPosition(valid.order());
        return field;
    }

    private static String blankToNull(final String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

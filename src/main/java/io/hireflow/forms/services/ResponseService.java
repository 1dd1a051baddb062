package io.hireflow.forms.services;

import static io.hireflow.forms.util.TimeUtils.utcNow;

import io.hireflow.forms.config.FormsProperties;
import io.hireflow.forms.domain.FormInvitation;
import io.hireflow.forms.domain.FormResponse;
import io.hireflow.forms.domain.FormResponseAnswer;
import io.hireflow.forms.domain.FormSnapshot.SnapshotField;
import io.hireflow.forms.domain.InvitationStatus;
import io.hireflow.forms.errors.InvalidTransitionException;
import io.hireflow.forms.errors.TokenExpiredException;
import io.hireflow.forms.errors.TokenNotFoundException;
import io.hireflow.forms.model.RecruiterContext;
import io.hireflow.forms.model.ResponseDetail;
import io.hireflow.forms.model.SubmitRequest;
import io.hireflow.forms.model.SubmitResponse;
import io.hireflow.forms.model.UploadResponse;
import io.hireflow.forms.repo.CandidateApplicationRepository;
import io.hireflow.forms.repo.FormInvitationRepository;
import io.hireflow.forms.repo.FormResponseRepository;
import io.hireflow.forms.services.AnswerValidator.ValidAnswer;
import io.hireflow.forms.services.mapper.FormsMapper;
import io.hireflow.forms.storage.StorageService;
import io.hireflow.forms.token.TokenIssuer;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@Service
@Transactional(readOnly = true)
public class ResponseService {

    static final String SUBMITTED_MESSAGE = "Thank you! Your responses have been submitted.";

    private static final String FILENAME_UNSAFE = "[^A-Za-z0-9._-]";
    private static final int MAX_FILENAME_LENGTH = 100;

    private final TokenIssuer tokenIssuer;
    private final InvitationGuard invitationGuard;
    private final AnswerValidator answerValidator;
    private final FormInvitationRepository formInvitationRepository;
    private final FormResponseRepository formResponseRepository;
    private final CandidateApplicationRepository candidateApplicationRepository;
    private final Optional<StorageService> storageService;
    private final FormsProperties formsProperties;
    private final FormsMapper mapper;
    private final Clock clock;

    public ResponseService(
            final TokenIssuer tokenIssuer,
            final InvitationGuard invitationGuard,
            final AnswerValidator answerValidator,
            final FormInvitationRepository formInvitationRepository,
            final FormResponseRepository formResponseRepository,
            final CandidateApplicationRepository candidateApplicationRepository,
            final Optional<StorageService> storageService,
            final FormsProperties formsProperties,
            final FormsMapper mapper,
            final Clock clock
    ) {
        this.tokenIssuer = tokenIssuer;
        this.invitationGuard = invitationGuard;
        this.answerValidator = answerValidator;
        this.formInvitationRepository = formInvitationRepository;
        this.formResponseRepository = formResponseRepository;
        this.candidateApplicationRepository = candidateApplicationRepository;
        this.storageService = storageService;
        this.formsProperties = formsProperties;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Records the candidate's answers and closes the invitation. The invitation row is locked for
     * the whole transaction, so two concurrent submits cannot both succeed.
     */
    @Transactional(noRollbackFor = TokenExpiredException.class)
    public SubmitResponse submit(final String token, final SubmitRequest request) {
        final FormInvitation invitation = tokenIssuer.findForUpdate(token).orElseThrow(TokenNotFoundException::new);
        final OffsetDateTime now = utcNow(clock);
        invitationGuard.checkUsable(invitation, now);
        if (invitation.getStatus() != InvitationStatus.SENT && invitation.getStatus() != InvitationStatus.VIEWED) {
            throw new InvalidTransitionException(invitation.getStatus(), InvitationStatus.ANSWERED,
                    "This form is not open for answers yet");
        }

        final Map<UUID, ValidAnswer> answers = answerValidator.validate(invitation.getFieldSnapshot(), request.answers());

        final FormResponse response = new FormResponse();
        response.setId(UUID.randomUUID());
        response.setInvitationId(invitation.getId());
        response.setApplicationId(invitation.getApplicationId());
        response.setFormId(invitation.getFormId());
        response.setOrganizationId(invitation.getOrganizationId());
        response.setFormName(invitation.getFieldSnapshot().formName());
        response.setSubmittedAt(now);
        int position = 0;
        for (final SnapshotField field : invitation.getFieldSnapshot().fields()) {
            final ValidAnswer valid = answers.get(field.id());
            final FormResponseAnswer answer = new FormResponseAnswer();
            answer.setId(UUID.randomUUID());
            answer.setFieldId(field.id());
            answer.setQuestion(field.label());
            answer.setFieldType(field.type());
            answer.setAnswer(valid == null ? null : valid.answer());
            answer.setFileUrl(valid == null ? null : valid.fileUrl());
            answer.setPosition(position++);
            response.addAnswer(answer);
        }
        formResponseRepository.save(response);

        invitation.transitionTo(InvitationStatus.ANSWERED, now);
        formInvitationRepository.save(invitation);

        log.info("Invitation id={} answered response={} answers={}", invitation.getId(), response.getId(),
                Integer.valueOf(answers.size()));
        return new SubmitResponse(response.getId(), now, SUBMITTED_MESSAGE);
    }

    /**
     * Stores a candidate file for a later submit. The token is checked in its own short transaction;
     * the upload itself runs outside any transaction.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public UploadResponse upload(final String token, final MultipartFile file) {
        final StorageService storage = storageService.orElseThrow(() ->
                new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "File uploads are not available"));
        final FormInvitation invitation = invitationGuard.requireUsable(token);

        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Uploaded file is empty");
        }
        final long maxBytes = formsProperties.getUpload().getMaxBytes();
        if (file.getSize() > maxBytes) {
            throw new ResponseStatusException(HttpStatus.PAYLOAD_TOO_LARGE,
                    "File exceeds the maximum size of " + maxBytes + " bytes");
        }

        final String filename = sanitizeFilename(file.getOriginalFilename());
        final String blobPath = "invitations/" + invitation.getId() + "/" + UUID.randomUUID() + "-" + filename;
        final Map<String, String> metadata = Map.of(
                "invitationId", invitation.getId().toString(),
                "applicationId", invitation.getApplicationId().toString(),
                "filename", filename);
        final String url;
        try (InputStream data = file.getInputStream()) {
            url = storage.store(blobPath, data, file.getSize(), file.getContentType(), metadata);
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Could not read uploaded file", e);
        }
        log.info("Stored upload for invitation id={} path={} size={}", invitation.getId(), blobPath,
                Long.valueOf(file.getSize()));
        return new UploadResponse(url, filename, file.getSize());
    }

    public List<ResponseDetail> listResponses(final RecruiterContext recruiter, final UUID applicationId) {
        candidateApplicationRepository.findById(applicationId)
                .filter(application -> application.getOrganizationId().equals(recruiter.organizationId()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Application not found: " + applicationId));
        return formResponseRepository
                .findByApplicationIdAndOrganizationIdOrderBySubmittedAtDesc(applicationId, recruiter.organizationId())
                .stream()
                .map(mapper::toResponseDetail)
                .toList();
    }

    public ResponseDetail getResponse(final RecruiterContext recruiter, final UUID responseId) {
        return formResponseRepository.findByIdAndOrganizationId(responseId, recruiter.organizationId())
                .map(mapper::toResponseDetail)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Response not found: " + responseId));
    }

    static String sanitizeFilename(final String original) {
        final String base = StringUtils.getFilename(StringUtils.cleanPath(original == null ? "" : original));
        String cleaned = base == null ? "" : base.replaceAll(FILENAME_UNSAFE, "_");
        if (cleaned.isBlank() || cleaned.chars().allMatch(c -> c == '.' || c == '_')) {
            cleaned = "upload";
        }
        return cleaned.length() > MAX_FILENAME_LENGTH ? cleaned.substring(cleaned.length() - MAX_FILENAME_LENGTH) : cleaned;
    }
}

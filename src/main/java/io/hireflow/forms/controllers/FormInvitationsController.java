package io.hireflow.forms.controllers;

import static io.hireflow.forms.util.RequestUtils.currentRecruiter;

import io.hireflow.forms.domain.InvitationStatus;
import io.hireflow.forms.model.BulkIssueRequest;
import io.hireflow.forms.model.BulkIssueResponse;
import io.hireflow.forms.model.InvitationResponse;
import io.hireflow.forms.model.IssueInvitationRequest;
import io.hireflow.forms.model.QuotaResponse;
import io.hireflow.forms.model.RecruiterContext;
import io.hireflow.forms.model.ResendRequest;
import io.hireflow.forms.quota.CounterKind;
import io.hireflow.forms.quota.QuotaLedger;
import io.hireflow.forms.services.InvitationService;
import io.hireflow.forms.services.mapper.FormsMapper;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Form invitations")
@RestController
public class FormInvitationsController {

    private final InvitationService invitationService;
    private final QuotaLedger quotaLedger;
    private final FormsMapper mapper;

    public FormInvitationsController(final InvitationService invitationService,
                                     final QuotaLedger quotaLedger,
                                     final FormsMapper mapper) {
        this.invitationService = invitationService;
        this.quotaLedger = quotaLedger;
        this.mapper = mapper;
    }

    /**
     * 201 when the email went out, 202 when the invitation was recorded but delivery failed.
     */
    @PostMapping("/api/forms/invitations")
    public ResponseEntity<InvitationResponse> issue(@Valid @RequestBody final IssueInvitationRequest request) {
        return created(invitationService.issue(currentRecruiter(), request));
    }

    @PostMapping("/api/forms/invitations/bulk")
    public ResponseEntity<BulkIssueResponse> bulkIssue(@Valid @RequestBody final BulkIssueRequest request) {
        return ResponseEntity.ok(invitationService.bulkIssue(currentRecruiter(), request));
    }

    @PostMapping("/api/forms/invitations/{id}/resend")
    public ResponseEntity<InvitationResponse> resend(@PathVariable("id") final UUID id,
                                                     @Valid @RequestBody(required = false) final ResendRequest request) {
        final String customMessage = request == null ? null : request.customMessage();
        return created(invitationService.resend(currentRecruiter(), id, customMessage));
    }

    @PostMapping("/api/forms/invitations/{id}/remind")
    public ResponseEntity<InvitationResponse> remind(@PathVariable("id") final UUID id) {
        return ResponseEntity.ok(invitationService.remind(currentRecruiter(), id));
    }

    @GetMapping("/api/applications/{applicationId}/invitations")
    public ResponseEntity<List<InvitationResponse>> listForApplication(@PathVariable("applicationId") final UUID applicationId) {
        return ResponseEntity.ok(invitationService.listForApplication(currentRecruiter(), applicationId));
    }

    @GetMapping("/api/forms/quota")
    public ResponseEntity<List<QuotaResponse>> quota() {
        final RecruiterContext recruiter = currentRecruiter();
        final List<QuotaResponse> body = Arrays.stream(CounterKind.values())
                .map(kind -> mapper.toQuotaResponse(quotaLedger.peek(recruiter.recruiterId(), kind)))
                .toList();
        return ResponseEntity.ok(body);
    }

    private static ResponseEntity<InvitationResponse> created(final InvitationResponse body) {
        final URI location = URI.create("/api/forms/invitations/" + body.id());
        if (body.status() == InvitationStatus.FAILED) {
            return ResponseEntity.accepted().location(location).body(body);
        }
        return ResponseEntity.created(location).body(body);
    }
}

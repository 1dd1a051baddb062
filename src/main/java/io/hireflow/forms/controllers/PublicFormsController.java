package io.hireflow.forms.controllers;

import static io.hireflow.forms.util.RequestUtils.clientIp;

import io.hireflow.forms.model.PublicFormView;
import io.hireflow.forms.model.SubmitRequest;
import io.hireflow.forms.model.SubmitResponse;
import io.hireflow.forms.model.UploadResponse;
import io.hireflow.forms.ratelimit.PublicRateLimiter;
import io.hireflow.forms.services.InvitationService;
import io.hireflow.forms.services.ResponseService;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Unauthenticated candidate endpoints. The token in the path is the only credential; every call is
 * rate limited per client IP.
 */
@Tag(name = "Public forms")
@RestController
@RequestMapping("/public/forms")
public class PublicFormsController {

    static final String RESOLVE = "resolve";
    static final String UPLOAD = "upload";
    static final String SUBMIT = "submit";

    private final InvitationService invitationService;
    private final ResponseService responseService;
    private final PublicRateLimiter publicRateLimiter;

    public PublicFormsController(final InvitationService invitationService,
                                 final ResponseService responseService,
                                 final PublicRateLimiter publicRateLimiter) {
        this.invitationService = invitationService;
        this.responseService = responseService;
        this.publicRateLimiter = publicRateLimiter;
    }

    @GetMapping("/{token}")
    public ResponseEntity<PublicFormView> resolve(@PathVariable("token") final String token,
                                                  final HttpServletRequest request) {
        publicRateLimiter.enforce(clientIp(request), RESOLVE);
        return ResponseEntity.ok(invitationService.resolve(token));
    }

    @PostMapping(value = "/{token}/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> upload(@PathVariable("token") final String token,
                                                 @RequestPart("file") final MultipartFile file,
                                                 final HttpServletRequest request) {
        publicRateLimiter.enforce(clientIp(request), UPLOAD);
        return ResponseEntity.status(HttpStatus.CREATED).body(responseService.upload(token, file));
    }

    @PostMapping("/{token}/submit")
    public ResponseEntity<SubmitResponse> submit(@PathVariable("token") final String token,
                                                 @Valid @RequestBody final SubmitRequest body,
                                                 final HttpServletRequest request) {
        publicRateLimiter.enforce(clientIp(request), SUBMIT);
        return ResponseEntity.status(HttpStatus.CREATED).body(responseService.submit(token, body));
    }
}

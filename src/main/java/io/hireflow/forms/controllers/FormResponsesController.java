package io.hireflow.forms.controllers;

import static io.hireflow.forms.util.RequestUtils.currentRecruiter;

import io.hireflow.forms.model.ExportFilter;
import io.hireflow.forms.model.RecruiterContext;
import io.hireflow.forms.model.ResponseDetail;
import io.hireflow.forms.services.ExportService;
import io.hireflow.forms.services.ResponseService;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

@Tag(name = "Form responses")
@RestController
public class FormResponsesController {

    public static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final ResponseService responseService;
    private final ExportService exportService;
    private final ObjectMapper objectMapper;

    public FormResponsesController(final ResponseService responseService,
                                   final ExportService exportService,
                                   final ObjectMapper objectMapper) {
        this.responseService = responseService;
        this.exportService = exportService;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/api/applications/{applicationId}/responses")
    public ResponseEntity<List<ResponseDetail>> listResponses(@PathVariable("applicationId") final UUID applicationId) {
        return ResponseEntity.ok(responseService.listResponses(currentRecruiter(), applicationId));
    }

    @GetMapping("/api/forms/responses/{id}")
    public ResponseEntity<ResponseDetail> getResponse(@PathVariable("id") final UUID id) {
        return ResponseEntity.ok(responseService.getResponse(currentRecruiter(), id));
    }

    /**
     * One JSON object per line, written as rows come off the database cursor.
     */
    @GetMapping("/api/forms/responses/export")
    public ResponseEntity<StreamingResponseBody> export(
            @RequestParam(value = "formId", required = false) final UUID formId,
            @RequestParam(value = "applicationId", required = false) final UUID applicationId,
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) final OffsetDateTime from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) final OffsetDateTime to
    ) {
        // identity is read on the request thread; the body is written later
        final RecruiterContext recruiter = currentRecruiter();
        final ExportFilter filter = new ExportFilter(formId, applicationId, from, to);
        final StreamingResponseBody body = outputStream -> writeRows(recruiter, filter, outputStream);
        return ResponseEntity.ok()
                .contentType(NDJSON)
                .header("Content-Disposition", "attachment; filename=\"form-responses.ndjson\"")
                .body(body);
    }

    private void writeRows(final RecruiterContext recruiter, final ExportFilter filter, final OutputStream outputStream)
            throws IOException {
        try {
            exportService.exportTo(recruiter, filter, row -> {
                try {
                    outputStream.write(objectMapper.writeValueAsBytes(row));
                    outputStream.write('\n');
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        outputStream.flush();
    }
}

package io.hireflow.forms.controllers;

import static io.hireflow.forms.util.RequestUtils.currentRecruiter;

import io.hireflow.forms.model.SuggestRequest;
import io.hireflow.forms.model.SuggestResponse;
import io.hireflow.forms.model.TemplateRequest;
import io.hireflow.forms.model.TemplateResponse;
import io.hireflow.forms.model.TemplateUpdateRequest;
import io.hireflow.forms.services.FieldSuggestionService;
import io.hireflow.forms.services.TemplateService;

import java.net.URI;
import java.util.List;
import java.util.UUID;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Form templates")
@RestController
@RequestMapping("/api/forms")
public class FormTemplatesController {

    private final TemplateService templateService;
    private final FieldSuggestionService fieldSuggestionService;

    public FormTemplatesController(final TemplateService templateService,
                                   final FieldSuggestionService fieldSuggestionService) {
        this.templateService = templateService;
        this.fieldSuggestionService = fieldSuggestionService;
    }

    @PostMapping("/templates")
    public ResponseEntity<TemplateResponse> createTemplate(@RequestBody final TemplateRequest request) {
        final TemplateResponse body = templateService.createTemplate(currentRecruiter(), request);
        return ResponseEntity.created(URI.create("/api/forms/templates/" + body.id())).body(body);
    }

    @GetMapping("/templates")
    public ResponseEntity<List<TemplateResponse>> listTemplates() {
        return ResponseEntity.ok(templateService.listTemplates(currentRecruiter()));
    }

    @GetMapping("/templates/{id}")
    public ResponseEntity<TemplateResponse> getTemplate(@PathVariable("id") final UUID id) {
        return ResponseEntity.ok(templateService.getTemplate(currentRecruiter(), id));
    }

    @PatchMapping("/templates/{id}")
    public ResponseEntity<TemplateResponse> updateTemplate(@PathVariable("id") final UUID id,
                                                           @RequestBody final TemplateUpdateRequest request) {
        return ResponseEntity.ok(templateService.updateTemplate(currentRecruiter(), id, request));
    }

    @DeleteMapping("/templates/{id}")
    public ResponseEntity<Void> deleteTemplate(@PathVariable("id") final UUID id) {
        templateService.deleteTemplate(currentRecruiter(), id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/ai-suggest")
    public ResponseEntity<SuggestResponse> suggestFields(@Valid @RequestBody final SuggestRequest request) {
        return ResponseEntity.ok(fieldSuggestionService.suggest(currentRecruiter(), request));
    }
}

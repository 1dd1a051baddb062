package io.hireflow.forms.services.mapper;

import io.hireflow.forms.domain.FormField;
import io.hireflow.forms.domain.FormInvitation;
import io.hireflow.forms.domain.FormResponse;
import io.hireflow.forms.domain.FormResponseAnswer;
import io.hireflow.forms.domain.FormTemplate;
import io.hireflow.forms.model.AnswerView;
import io.hireflow.forms.model.ExportRow;
import io.hireflow.forms.model.FieldResponse;
import io.hireflow.forms.model.InvitationResponse;
import io.hireflow.forms.model.PublicFormView;
import io.hireflow.forms.model.QuotaResponse;
import io.hireflow.forms.model.ResponseDetail;
import io.hireflow.forms.model.TemplateResponse;
import io.hireflow.forms.quota.QuotaDecision;

import java.util.List;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface FormsMapper {

    @Mapping(target = "order", source = "position")
    @Mapping(target = "options", expression = "java(field.getOptions() == null ? java.util.List.of() : java.util.List.copyOf(field.getOptions()))")
    FieldResponse toFieldResponse(FormField field);

    List<FieldResponse> toFieldResponses(List<FormField> fields);

    default TemplateResponse toTemplateResponse(final FormTemplate template) {
        return new TemplateResponse(
                template.getId(),
                template.getName(),
                template.getDescription(),
                template.isPublished(),
                template.getCreatedBy(),
                template.getCreatedAt(),
                template.getUpdatedAt(),
                toFieldResponses(template.getFields()));
    }

    default InvitationResponse toInvitationResponse(final FormInvitation invitation) {
        return new InvitationResponse(
                invitation.getId(),
                invitation.getApplicationId(),
                invitation.getFormId(),
                invitation.getFieldSnapshot() == null ? null : invitation.getFieldSnapshot().formName(),
                invitation.getStatus(),
                invitation.getExpiresAt(),
                invitation.getSentAt(),
                invitation.getViewedAt(),
                invitation.getAnsweredAt(),
                invitation.getReminderSentAt(),
                invitation.getCustomMessage(),
                invitation.getErrorMessage(),
                invitation.getSentBy(),
                invitation.getCreatedAt());
    }

    default PublicFormView toPublicFormView(final FormInvitation invitation) {
        return new PublicFormView(
                invitation.getFieldSnapshot().formName(),
                invitation.getFieldSnapshot().formDescription(),
                invitation.getFieldSnapshot().fields(),
                invitation.getExpiresAt(),
                invitation.getStatus());
    }

    AnswerView toAnswerView(FormResponseAnswer answer);

    List<AnswerView> toAnswerViews(List<FormResponseAnswer> answers);

    default ResponseDetail toResponseDetail(final FormResponse response) {
        return new ResponseDetail(
                response.getId(),
                response.getInvitationId(),
                response.getApplicationId(),
                response.getFormId(),
                response.getFormName(),
                response.getSubmittedAt(),
                toAnswerViews(response.getAnswers()));
    }

    default ExportRow toExportRow(final FormResponse response) {
        final List<ExportRow.Item> items = response.getAnswers().stream()
                .map(answer -> new ExportRow.Item(
                        answer.getQuestion(),
                        answer.getFieldType(),
                        answer.getAnswer() == null ? "" : answer.getAnswer(),
                        answer.getFileUrl() == null ? "" : answer.getFileUrl()))
                .toList();
        return new ExportRow(
                response.getId(),
                response.getApplicationId(),
                response.getFormName(),
                response.getSubmittedAt(),
                items);
    }

    default QuotaResponse toQuotaResponse(final QuotaDecision decision) {
        return new QuotaResponse(decision.kind(), decision.used(), decision.limit(), decision.remaining(), decision.resetAt());
    }
}

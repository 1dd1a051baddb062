package io.hireflow.forms.errors;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import org.springframework.http.HttpStatus;

public class DuplicateActiveInvitationException extends FormsException {

    private final UUID existingInvitationId;

    public DuplicateActiveInvitationException(final UUID existingInvitationId) {
        super(HttpStatus.CONFLICT, "DUPLICATE_ACTIVE_INVITATION",
                "An active invitation for this form already exists for this application");
        this.existingInvitationId = existingInvitationId;
    }

    public UUID getExistingInvitationId() {
        return existingInvitationId;
    }

    @Override
    public Map<String, Object> details() {
        // the id is unknown when the database index, not the service check, caught the duplicate
        final Map<String, Object> details = new HashMap<>();
        if (existingInvitationId != null) {
            details.put("existingInvitationId", existingInvitationId);
        }
        return details;
    }
}

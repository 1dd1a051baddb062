package io.hireflow.forms.errors;

import org.springframework.http.HttpStatus;

public class InvitationFailedException extends FormsException {

    public InvitationFailedException() {
        super(HttpStatus.GONE, "INVITATION_FAILED",
                "This invitation could not be delivered and is no longer valid. Please contact the recruiter.");
    }
}

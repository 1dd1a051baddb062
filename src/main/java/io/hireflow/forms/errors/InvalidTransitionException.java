package io.hireflow.forms.errors;

import io.hireflow.forms.domain.InvitationStatus;

import java.util.Map;

import org.springframework.http.HttpStatus;

public class InvalidTransitionException extends FormsException {

    private final InvitationStatus from;
    private final InvitationStatus to;

    public InvalidTransitionException(final InvitationStatus from, final InvitationStatus to) {
        this(from, to, "Invitation cannot move from " + from.wireValue() + " to " + to.wireValue());
    }

    public InvalidTransitionException(final InvitationStatus from, final InvitationStatus to, final String message) {
        super(HttpStatus.CONFLICT, "INVALID_TRANSITION", message);
        this.from = from;
        this.to = to;
    }

    public InvitationStatus getFrom() {
        return from;
    }

    public InvitationStatus getTo() {
        return to;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("from", from.wireValue(), "to", to.wireValue());
    }
}

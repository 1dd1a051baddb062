package io.hireflow.forms.errors;

import org.springframework.http.HttpStatus;

public class TokenNotFoundException extends FormsException {

    public TokenNotFoundException() {
        super(HttpStatus.FORBIDDEN, "INVALID_TOKEN",
                "Invalid invitation link. Please check the URL or contact the recruiter.");
    }
}

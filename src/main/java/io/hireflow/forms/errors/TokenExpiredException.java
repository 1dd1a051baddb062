package io.hireflow.forms.errors;

import org.springframework.http.HttpStatus;

public class TokenExpiredException extends FormsException {

    public TokenExpiredException() {
        super(HttpStatus.GONE, "FORM_EXPIRED",
                "This form invitation has expired. Please contact the recruiter for a new link.");
    }
}

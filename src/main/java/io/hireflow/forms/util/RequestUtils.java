package io.hireflow.forms.util;

import io.hireflow.forms.model.RecruiterContext;

import java.util.UUID;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.server.ResponseStatusException;

/**
 * Helpers for reading request-scoped data in controllers.
 */
public final class RequestUtils {

    public static final String RECRUITER_HEADER = "X-Recruiter-Id";
    public static final String ORGANIZATION_HEADER = "X-Organization-Id";

    private RequestUtils() {
    }

    /**
     * Obtain the current HttpServletRequest or throw 500 if not in a servlet request context.
     */
    public static HttpServletRequest currentRequest() {
        final RequestAttributes attrs = RequestContextHolder.getRequestAttributes();
        if (!(attrs instanceof ServletRequestAttributes sra)) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "No servlet request in context");
        }
        return sra.getRequest();
    }

    /**
     * Caller identity set by the upstream auth layer. Missing or malformed headers are a 401.
     */
    public static RecruiterContext currentRecruiter() {
        final HttpServletRequest request = currentRequest();
        return new RecruiterContext(
                requireUuidHeader(request, RECRUITER_HEADER),
                requireUuidHeader(request, ORGANIZATION_HEADER));
    }

    /**
     * Address the rate limiter keys on. Client supplied {@code X-Forwarded-For} values are never read
     * here; behind a proxy, {@code server.forward-headers-strategy=native} has the container replace
     * the remote address with the hop appended by a trusted proxy.
     */
    public static String clientIp(final HttpServletRequest request) {
        return request.getRemoteAddr();
    }

    private static UUID requireUuidHeader(final HttpServletRequest request, final String headerName) {
        final String value = request.getHeader(headerName);
        if (value == null || value.isBlank()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing required header: " + headerName);
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid header: " + headerName, e);
        }
    }
}

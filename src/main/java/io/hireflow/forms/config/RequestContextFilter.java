package io.hireflow.forms.config;

import io.hireflow.forms.util.RequestUtils;

import java.io.IOException;
import java.util.UUID;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Seeds the logging MDC for every request and echoes the correlation id back to the caller.
 */
@Component("correlationMdcFilter")
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RequestContextFilter implements Filter {

    public static final String CORRELATION_HEADER = "X-Correlation-Id";

    private static final String CLUSTER = System.getenv().getOrDefault("CLUSTER_NAME", "local");

    private static final String REGION = System.getenv().getOrDefault("REGION", "local");

    @Override
    public void doFilter(final ServletRequest req, final ServletResponse res, final FilterChain chain)
            throws IOException, ServletException {
        try {
            final HttpServletRequest httpServletRequest = (HttpServletRequest) req;
            String cid = httpServletRequest.getHeader(CORRELATION_HEADER);
            if (cid == null || cid.isBlank()) {
                cid = UUID.randomUUID().toString();
            }
            MDC.put("correlationId", cid);
            MDC.put("cluster", CLUSTER);
            MDC.put("region", REGION);
            MDC.put("path", httpServletRequest.getRequestURI());
            final String recruiter = httpServletRequest.getHeader(RequestUtils.RECRUITER_HEADER);
            if (recruiter != null && !recruiter.isBlank()) {
                MDC.put("recruiterId", recruiter);
            }
            if (res instanceof HttpServletResponse httpServletResponse) {
                httpServletResponse.setHeader(CORRELATION_HEADER, cid);
            }
            chain.doFilter(req, res);
        } finally {
            MDC.clear();
        }
    }
}

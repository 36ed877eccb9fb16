package com.taxdesk.engine.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Assigns every request a trace id (echoed back in {@value #TRACE_HEADER}) and exposes it, with the
 * optional client header, to the MDC and {@link RequestContextHolder} for the duration of the call.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TraceIdFilter.class);

    public static final String TRACE_HEADER = "X-Request-Trace";

    static final String MDC_TRACE_ID = "trace_id";
    static final String MDC_CLIENT_ID = "client_id";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }
        RequestContextHolder.RequestContext context = RequestContextHolder.RequestContext.builder()
                .traceId(traceId)
                .clientId(request.getHeader(RequestContextHolder.CLIENT_HEADER))
                .build();
        RequestContextHolder.set(context);
        MDC.put(MDC_TRACE_ID, traceId);
        if (context.clientId() != null) {
            MDC.put(MDC_CLIENT_ID, context.clientId());
        }
        response.setHeader(TRACE_HEADER, traceId);
        long started = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            log.debug("request_completed method={} path={} status={} durationMs={}",
                    request.getMethod(), request.getRequestURI(), response.getStatus(),
                    (System.nanoTime() - started) / 1_000_000);
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_CLIENT_ID);
            RequestContextHolder.clear();
        }
    }
}

package com.taxdesk.engine.web;

import java.util.Optional;

/**
 * Per-request values captured by {@link TraceIdFilter}. The optional client header is only used
 * for log correlation; the client id that scopes a calculation always comes from the request body.
 */
public final class RequestContextHolder {

    public static final String CLIENT_HEADER = "X-Client-Id";

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> traceId() {
        return get().map(RequestContext::traceId);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    public record RequestContext(String traceId, String clientId) {

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private String traceId;
            private String clientId;

            public Builder traceId(String traceId) {
                this.traceId = traceId;
                return this;
            }

            public Builder clientId(String clientId) {
                this.clientId = clientId == null || clientId.isBlank() ? null : clientId.trim();
                return this;
            }

            public RequestContext build() {
                return new RequestContext(traceId, clientId);
            }
        }
    }
}

package com.dev.prostaff.tenant;

import com.dev.prostaff.security.Identity;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Owns the {@link TenantContext} of one unit of work. Held by that unit of work, never by a
 * process-wide holder, and closed when it ends; a closed scope no longer hands out its context.
 * While open, the MDC of the opening thread carries {@code tenantId} and {@code userId}.
 */
@Slf4j
public final class TenantScope implements AutoCloseable {

    public static final String REQUEST_ATTRIBUTE = "prostaff.tenantScope";

    static final String MDC_TENANT_ID = "tenantId";
    static final String MDC_USER_ID = "userId";

    private final TenantContext context;
    private volatile boolean closed;

    private TenantScope(TenantContext context) {
        this.context = context;
    }

    public static TenantScope open(Identity identity) {
        return open(TenantContext.of(identity));
    }

    public static TenantScope open(TenantContext context) {
        TenantScope scope = new TenantScope(context);
        MDC.put(MDC_TENANT_ID, context.organizationId().toString());
        MDC.put(MDC_USER_ID, context.userId().toString());
        log.trace("Tenant scope opened for org={}", context.organizationId());
        return scope;
    }

    public TenantContext context() {
        if (closed) {
            throw new IllegalStateException("Tenant scope already closed");
        }
        return context;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        MDC.remove(MDC_TENANT_ID);
        MDC.remove(MDC_USER_ID);
        log.trace("Tenant scope closed for org={}", context.organizationId());
    }
}

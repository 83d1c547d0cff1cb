package com.rolebridge.sync;

import com.rolebridge.identity.IdentityEvent;
import com.rolebridge.identity.IdentityKind;
import org.slf4j.MDC;

/**
 * Puts the identity being synchronized into the SLF4J MDC so every log line written while handling
 * it carries {@code identityKind}, {@code identityId} and {@code eventType}.
 */
final class SyncLogContext {

    static final String MDC_IDENTITY_KIND = "identityKind";
    static final String MDC_IDENTITY_ID = "identityId";
    static final String MDC_EVENT_TYPE = "eventType";

    private SyncLogContext() {
        // utility class
    }

    static void set(IdentityEvent event) {
        set(event.kind(), event.identityId());
        put(MDC_EVENT_TYPE, event.type() == null ? null : event.type().value());
    }

    static void set(IdentityKind kind, String identityId) {
        put(MDC_IDENTITY_KIND, kind == null ? null : kind.value());
        put(MDC_IDENTITY_ID, identityId);
    }

    static void clear() {
        MDC.remove(MDC_IDENTITY_KIND);
        MDC.remove(MDC_IDENTITY_ID);
        MDC.remove(MDC_EVENT_TYPE);
    }

    private static void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}

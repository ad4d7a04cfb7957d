package com.kita.invoicing.orchestration;

import java.util.Map;

/**
 * Sink for business audit entries
 */
public interface AuditLogger {

    /**
     * Record an action
     *
     * @param actor who performed the action, usually a tenant id
     * @param action dotted action name, e.g. {@code invoice.issued}
     * @param entityType affected entity type
     * @param entityId affected entity id
     * @param before state before the action, may be null
     * @param after state after the action, may be null
     */
    void log(String actor, String action, String entityType, String entityId,
             Map<String, Object> before, Map<String, Object> after);
}

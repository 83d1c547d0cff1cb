package com.rolebridge.database.migration;

/**
 * Outcome of applying one entity's permission declarations.
 *
 * @param entityName the entity
 * @param applied statements executed in this run
 * @param skipped statements found in the ledger and not executed again
 */
public record PermissionApplyResult(String entityName, int applied, int skipped) {

    public boolean isNoop() {
        return applied == 0;
    }
}

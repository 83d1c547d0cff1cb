package com.rolebridge.database.migration;

/**
 * A permission declaration statement failed. The entity's whole batch has been rolled back.
 */
public class PermissionApplyException extends RuntimeException {

    private final String entityName;
    private final int statementIndex;

    public PermissionApplyException(String entityName, int statementIndex, String statement, Throwable cause) {
        super("Permission declaration %d for '%s' failed: %s".formatted(statementIndex, entityName, statement),
                cause);
        this.entityName = entityName;
        this.statementIndex = statementIndex;
    }

    public String entityName() {
        return entityName;
    }

    /** Zero-based position of the failing statement in the declaration. */
    public int statementIndex() {
        return statementIndex;
    }
}

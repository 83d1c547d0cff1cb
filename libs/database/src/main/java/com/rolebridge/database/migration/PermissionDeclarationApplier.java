package com.rolebridge.database.migration;

import java.util.List;

/**
 * Applies the access-control statements declared for one schema entity.
 *
 * <p>Statements run in the given order, inside one transaction, at the session's own (highest)
 * privileges. Statements already applied for the entity are skipped, so replaying a migration is
 * safe. If any statement fails, none of the batch is kept.
 */
public interface PermissionDeclarationApplier {

    /**
     * @param entityName schema entity the statements belong to, e.g. a table name
     * @param statements raw statements, in declaration order
     * @return how many statements ran and how many were skipped
     * @throws PermissionApplyException if a statement failed; the batch was rolled back
     */
    PermissionApplyResult apply(String entityName, List<String> statements);
}

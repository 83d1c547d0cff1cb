package com.rolebridge.database;

import java.sql.SQLException;

/**
 * SQLSTATE codes RoleBridge reacts to, and extraction from wrapped exceptions.
 */
public final class SqlStates {

    /** dependent_objects_still_exist. */
    public static final String DEPENDENT_OBJECTS_STILL_EXIST = "2BP01";

    /** object_in_use. */
    public static final String OBJECT_IN_USE = "55006";

    /** duplicate_object. */
    public static final String DUPLICATE_OBJECT = "42710";

    /** undefined_object. */
    public static final String UNDEFINED_OBJECT = "42704";

    private SqlStates() {
        // utility class
    }

    /** The SQLSTATE of the first {@link SQLException} in the cause chain, or null. */
    public static String of(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof SQLException sql && sql.getSQLState() != null) {
                return sql.getSQLState();
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    /** Whether a failed {@code DROP ROLE} means the role is still in use rather than broken. */
    public static boolean isRemovalBlocked(Throwable failure) {
        String state = of(failure);
        return DEPENDENT_OBJECTS_STILL_EXIST.equals(state) || OBJECT_IN_USE.equals(state);
    }
}

package com.rolebridge.database.migration;

import java.util.List;
import java.util.Map;

/**
 * Supplies declared permission statements per schema entity. Iteration order of the returned map
 * is the order entities are applied in.
 */
@FunctionalInterface
public interface PermissionDeclarationSource {

    Map<String, List<String>> declarations();
}

/**
 * PostgreSQL adapters for RoleBridge.
 *
 * <ul>
 *   <li>{@link com.rolebridge.database.role}: the role catalog over {@code pg_roles}
 *   <li>{@link com.rolebridge.database.session}: {@code SET ROLE} / {@code RESET ROLE} sessions
 *       leased from a HikariCP pool
 *   <li>{@link com.rolebridge.database.sync}: the pending identity-event table
 *   <li>{@link com.rolebridge.database.migration}: permission declarations applied after Flyway
 *       migrations
 * </ul>
 *
 * <p>Schema lives in {@code classpath:db/migration/rolebridge}.
 */
package com.rolebridge.database;

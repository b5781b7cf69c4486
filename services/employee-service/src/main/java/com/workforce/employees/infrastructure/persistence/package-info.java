/**
 * JDBC persistence: entity mappings used by the unit of work and read-only repositories.
 *
 * <p>WHY: Reads are plain SQL through {@code NamedParameterJdbcTemplate}; every write goes
 * through the audited unit of work so that audit fields cannot be bypassed.
 */
package com.workforce.employees.infrastructure.persistence;

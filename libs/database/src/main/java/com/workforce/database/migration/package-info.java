/**
 * Flyway migration wiring and status reporting.
 */
package com.workforce.database.migration;

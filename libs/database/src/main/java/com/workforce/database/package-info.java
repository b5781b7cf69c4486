/**
 * Persistence support shared by workforce services: a JDBC unit of work, commit-time audit
 * stamping and Flyway migration wiring.
 */
package com.workforce.database;

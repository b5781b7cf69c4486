/**
 * Domain entities of the employee service. Plain objects with no persistence annotations; the
 * table mappings live in {@code infrastructure.persistence}.
 */
package com.workforce.employees.domain;

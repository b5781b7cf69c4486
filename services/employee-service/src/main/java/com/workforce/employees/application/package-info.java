/**
 * Use cases of the employee service. Services load through repositories and write through a
 * fresh audited unit of work per operation.
 */
package com.workforce.employees.application;

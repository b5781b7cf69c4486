/**
 * Commit-time audit stamping.
 *
 * <p>WHY: Audit fields are written in one place, as a decorator around the unit-of-work commit,
 * so that domain handlers cannot forget or forge them and a frozen {@link java.time.Clock} makes
 * the timestamps exact in tests.
 */
package com.workforce.database.audit;

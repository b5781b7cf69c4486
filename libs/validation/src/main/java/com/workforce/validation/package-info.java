/**
 * Request payload validation.
 *
 * <ul>
 *   <li>{@link com.workforce.validation.ValidatorRegistry} maps a payload type to its validator.
 *   <li>{@link com.workforce.validation.AbstractValidator} composes synchronous and asynchronous
 *       field rules into a deterministic {@link com.workforce.validation.ValidationOutcome}.
 *   <li>{@link com.workforce.validation.RuleContext} hands route values and a lookup executor to
 *       rules that consult persisted state.
 *   <li>{@link com.workforce.validation.ValidationPipeline} gates a handler on the aggregate
 *       outcome of all its payloads.
 * </ul>
 *
 * <p>The package has no framework dependency; the web adapter lives in the service.
 */
package com.workforce.validation;

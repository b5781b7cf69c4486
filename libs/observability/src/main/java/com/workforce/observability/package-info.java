/**
 * Request correlation and metrics helpers shared by the Workforce services.
 */
package com.workforce.observability;

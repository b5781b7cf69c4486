package com.workforce.database.audit;

/**
 * Records every write as made by a fixed placeholder author.
 * <p>
 * Audit authorship is not tied to the caller: requests are authenticated by an external identity
 * provider whose principal is not propagated into this service.
 */
public final class SystemAuditorProvider implements AuditorProvider {

    /** Placeholder author name. */
    public static final String SYSTEM = "system";

    // TODO: resolve the authenticated caller once the identity provider forwards a principal.
    @Override
    public String currentAuditor() {
        return SYSTEM;
    }
}

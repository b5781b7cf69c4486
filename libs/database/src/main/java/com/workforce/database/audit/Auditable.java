package com.workforce.database.audit;

import java.time.Instant;

/**
 * Capability of entities whose creation and modification are stamped at commit time.
 * <p>
 * Only {@link AuditingUnitOfWork} writes these fields; domain code reads them.
 */
public interface Auditable {

    String getCreatedBy();

    void setCreatedBy(String createdBy);

    Instant getCreatedAt();

    void setCreatedAt(Instant createdAt);

    String getModifiedBy();

    void setModifiedBy(String modifiedBy);

    Instant getModifiedAt();

    void setModifiedAt(Instant modifiedAt);
}

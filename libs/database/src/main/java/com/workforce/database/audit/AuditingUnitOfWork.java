package com.workforce.database.audit;

import com.workforce.database.uow.EntityMapping;
import com.workforce.database.uow.PendingChange;
import com.workforce.database.uow.UnitOfWork;
import com.workforce.observability.MetricFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates a {@link UnitOfWork} so that its commit stamps audit metadata on {@link Auditable}
 * entities.
 * <p>
 * On each commit the pending change set is read once and the clock is read once:
 *
 * <ul>
 *   <li>added entities get {@code createdBy}/{@code createdAt};
 *   <li>modified entities get {@code modifiedBy}/{@code modifiedAt}, creation fields untouched;
 *   <li>unchanged and deleted entities are left alone.
 * </ul>
 *
 * All entities of one commit share the same timestamp. If the underlying commit throws, the
 * audit fields of every stamped entity are restored to their previous values before the
 * exception propagates.
 */
public class AuditingUnitOfWork implements UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(AuditingUnitOfWork.class);

    /** Counter of stamped entities, tagged {@code kind=created|modified}. */
    public static final String METRIC_STAMPED = "workforce.audit.stamped";

    private final UnitOfWork delegate;
    private final Clock clock;
    private final AuditorProvider auditorProvider;
    private final MetricFactory metrics;

    public AuditingUnitOfWork(
            UnitOfWork delegate, Clock clock, AuditorProvider auditorProvider, MetricFactory metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.auditorProvider = Objects.requireNonNull(auditorProvider, "auditorProvider");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public <E> E add(E entity, EntityMapping<E> mapping) {
        return delegate.add(entity, mapping);
    }

    @Override
    public <E> E track(E entity, EntityMapping<E> mapping) {
        return delegate.track(entity, mapping);
    }

    @Override
    public <E> void remove(E entity, EntityMapping<E> mapping) {
        delegate.remove(entity, mapping);
    }

    @Override
    public List<PendingChange> pendingChanges() {
        return delegate.pendingChanges();
    }

    @Override
    public int commit() {
        List<PendingChange> changes = delegate.pendingChanges();
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        String auditor = auditorProvider.currentAuditor();

        List<Stamp> stamps = new ArrayList<>();
        int created = 0;
        int modified = 0;
        for (PendingChange change : changes) {
            if (!(change.entity() instanceof Auditable auditable)) {
                continue;
            }
            switch (change.state()) {
                case ADDED -> {
                    stamps.add(Stamp.of(auditable));
                    auditable.setCreatedBy(auditor);
                    auditable.setCreatedAt(now);
                    created++;
                }
                case MODIFIED -> {
                    stamps.add(Stamp.of(auditable));
                    auditable.setModifiedBy(auditor);
                    auditable.setModifiedAt(now);
                    modified++;
                }
                default -> { }
            }
        }

        int rows;
        try {
            rows = delegate.commit();
        } catch (RuntimeException e) {
            stamps.forEach(Stamp::restore);
            log.debug("Commit failed, restored audit fields of {} entities", stamps.size());
            throw e;
        }

        if (created > 0) {
            metrics.counter(METRIC_STAMPED, "Entities stamped at commit", "kind", "created").increment(created);
        }
        if (modified > 0) {
            metrics.counter(METRIC_STAMPED, "Entities stamped at commit", "kind", "modified").increment(modified);
        }
        return rows;
    }

    private record Stamp(
            Auditable entity, String createdBy, Instant createdAt, String modifiedBy, Instant modifiedAt) {

        static Stamp of(Auditable entity) {
            return new Stamp(entity, entity.getCreatedBy(), entity.getCreatedAt(),
                    entity.getModifiedBy(), entity.getModifiedAt());
        }

        void restore() {
            entity.setCreatedBy(createdBy);
            entity.setCreatedAt(createdAt);
            entity.setModifiedBy(modifiedBy);
            entity.setModifiedAt(modifiedAt);
        }
    }
}

package com.workforce.database.uow;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import org.springframework.jdbc.core.RowMapper;

/**
 * Explicit table mapping for one entity type.
 * <p>
 * Implementations are stateless singletons. {@link #columns(Object)} must return the persisted
 * columns in a stable order and without the id column; the unit of work compares two such maps to
 * decide whether a tracked entity changed.
 *
 * @param <E> entity type
 */
public interface EntityMapping<E> {

    /** Table name. */
    String table();

    /** Primary key column. */
    String idColumn();

    /** Current id of the entity, or {@code null} when not yet assigned. */
    Object id(E entity);

    /**
     * Writes a database-generated id back onto the entity. Called with {@code null} to clear an
     * id that was assigned by a commit that later failed.
     */
    void assignId(E entity, Number id);

    /** True when the database generates the id on insert. */
    boolean generatedId();

    /** Persisted column values keyed by column name, id excluded. */
    Map<String, Object> columns(E entity);

    /** Maps a result row to a new entity instance. */
    RowMapper<E> rowMapper();

    /** Converts an instant to the JDBC type used for {@code TIMESTAMP WITH TIME ZONE}. */
    static OffsetDateTime timestamp(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    /** Reverse of {@link #timestamp(Instant)}. */
    static Instant instant(OffsetDateTime timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}

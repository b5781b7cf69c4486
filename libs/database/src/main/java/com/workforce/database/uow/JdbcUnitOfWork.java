package com.workforce.database.uow;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link UnitOfWork} backed by Spring JDBC.
 * <p>
 * A commit runs inside one {@link TransactionTemplate} transaction and writes deletes first, then
 * inserts, then updates. After a successful commit added entities become tracked with a fresh
 * snapshot and deleted entities are forgotten, so the same instance can be committed again.
 */
public class JdbcUnitOfWork implements UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(JdbcUnitOfWork.class);

    private static final String ID_PARAM = "__id";

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final Map<Object, Entry<?>> entries = new IdentityHashMap<>();
    private final List<Entry<?>> order = new ArrayList<>();

    public JdbcUnitOfWork(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
    }

    @Override
    public <E> E add(E entity, EntityMapping<E> mapping) {
        Entry<E> entry = register(entity, mapping);
        if (entry.stored) {
            throw new IllegalStateException("Entity is already tracked as stored: " + describe(entry));
        }
        entry.removed = false;
        return entity;
    }

    @Override
    public <E> E track(E entity, EntityMapping<E> mapping) {
        Entry<E> entry = register(entity, mapping);
        if (mapping.id(entity) == null) {
            throw new IllegalArgumentException("Only stored entities can be tracked: " + describe(entry));
        }
        entry.stored = true;
        entry.removed = false;
        entry.snapshot = mapping.columns(entity);
        return entity;
    }

    @Override
    public <E> void remove(E entity, EntityMapping<E> mapping) {
        boolean known = entity != null && entries.containsKey(entity);
        Entry<E> entry = register(entity, mapping);
        if (!entry.stored && (known || mapping.id(entity) == null)) {
            forget(entry);
            return;
        }
        entry.stored = true;
        entry.removed = true;
    }

    @Override
    public List<PendingChange> pendingChanges() {
        List<PendingChange> changes = new ArrayList<>(order.size());
        for (Entry<?> entry : order) {
            changes.add(new PendingChange(entry.entity, entry.state()));
        }
        return changes;
    }

    @Override
    public int commit() {
        List<Entry<?>> deletes = new ArrayList<>();
        List<Entry<?>> inserts = new ArrayList<>();
        List<Entry<?>> updates = new ArrayList<>();
        for (Entry<?> entry : order) {
            switch (entry.state()) {
                case DELETED -> deletes.add(entry);
                case ADDED -> inserts.add(entry);
                case MODIFIED -> updates.add(entry);
                case UNCHANGED -> { }
            }
        }
        if (deletes.isEmpty() && inserts.isEmpty() && updates.isEmpty()) {
            return 0;
        }

        List<Entry<?>> assigned = new ArrayList<>();
        int rows;
        try {
            Integer written = transactionTemplate.execute(status -> {
                int count = 0;
                for (Entry<?> entry : deletes) {
                    count += delete(entry);
                }
                for (Entry<?> entry : inserts) {
                    count += insert(entry, assigned);
                }
                for (Entry<?> entry : updates) {
                    count += update(entry);
                }
                return count;
            });
            rows = written == null ? 0 : written;
        } catch (DataIntegrityViolationException e) {
            clearAssignedIds(assigned);
            throw new ConstraintViolationException("Commit rejected by a constraint: "
                    + e.getMostSpecificCause().getMessage(), e);
        } catch (DataAccessException | TransactionException e) {
            clearAssignedIds(assigned);
            throw new CommitFailedException("Commit failed: " + e.getMessage(), e);
        } catch (CommitFailedException e) {
            clearAssignedIds(assigned);
            throw e;
        }

        for (Entry<?> entry : deletes) {
            forget(entry);
        }
        for (Entry<?> entry : inserts) {
            entry.markStored();
        }
        for (Entry<?> entry : updates) {
            entry.markStored();
        }
        log.debug("Committed unit of work: deleted={}, inserted={}, updated={}, rows={}",
                deletes.size(), inserts.size(), updates.size(), rows);
        return rows;
    }

    // ── Private Helpers ──

    @SuppressWarnings("unchecked")
    private <E> Entry<E> register(E entity, EntityMapping<E> mapping) {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(mapping, "mapping");
        Entry<?> existing = entries.get(entity);
        if (existing != null) {
            if (existing.mapping != mapping) {
                throw new IllegalArgumentException("Entity registered with a different mapping: "
                        + describe(existing));
            }
            return (Entry<E>) existing;
        }
        Entry<E> entry = new Entry<>(entity, mapping);
        entries.put(entity, entry);
        order.add(entry);
        return entry;
    }

    private void forget(Entry<?> entry) {
        entries.remove(entry.entity);
        order.remove(entry);
    }

    private <E> int delete(Entry<E> entry) {
        EntityMapping<E> mapping = entry.mapping;
        String sql = "DELETE FROM " + mapping.table() + " WHERE " + mapping.idColumn() + " = :" + ID_PARAM;
        return jdbc.update(sql, new MapSqlParameterSource(ID_PARAM, mapping.id(entry.entity)));
    }

    private <E> int insert(Entry<E> entry, List<Entry<?>> assigned) {
        EntityMapping<E> mapping = entry.mapping;
        Map<String, Object> columns = new LinkedHashMap<>(mapping.columns(entry.entity));
        if (!mapping.generatedId()) {
            Object id = mapping.id(entry.entity);
            if (id == null) {
                throw new IllegalStateException("Entity without generated id has no id: " + describe(entry));
            }
            columns.put(mapping.idColumn(), id);
        }
        String sql = "INSERT INTO " + mapping.table()
                + " (" + String.join(", ", columns.keySet()) + ")"
                + " VALUES (" + columns.keySet().stream().map(c -> ":" + c).collect(Collectors.joining(", ")) + ")";
        MapSqlParameterSource params = new MapSqlParameterSource(columns);
        if (!mapping.generatedId()) {
            return jdbc.update(sql, params);
        }

        KeyHolder keys = new GeneratedKeyHolder();
        int rows = jdbc.update(sql, params, keys, new String[] {mapping.idColumn()});
        Number key = keys.getKey();
        if (key == null) {
            throw new CommitFailedException("No key generated for " + mapping.table(), null);
        }
        mapping.assignId(entry.entity, key);
        assigned.add(entry);
        return rows;
    }

    private <E> int update(Entry<E> entry) {
        EntityMapping<E> mapping = entry.mapping;
        Map<String, Object> columns = mapping.columns(entry.entity);
        String sql = "UPDATE " + mapping.table() + " SET "
                + columns.keySet().stream().map(c -> c + " = :" + c).collect(Collectors.joining(", "))
                + " WHERE " + mapping.idColumn() + " = :" + ID_PARAM;
        MapSqlParameterSource params = new MapSqlParameterSource(columns)
                .addValue(ID_PARAM, mapping.id(entry.entity));
        int rows = jdbc.update(sql, params);
        if (rows == 0) {
            throw new CommitFailedException("No row updated for " + describe(entry), null);
        }
        return rows;
    }

    private static void clearAssignedIds(List<Entry<?>> assigned) {
        for (Entry<?> entry : assigned) {
            entry.clearId();
        }
    }

    private static <E> String describe(Entry<E> entry) {
        return entry.mapping.table() + "#" + entry.mapping.id(entry.entity);
    }

    private static boolean sameColumns(Map<String, Object> left, Map<String, Object> right) {
        if (!left.keySet().equals(right.keySet())) {
            return false;
        }
        for (Map.Entry<String, Object> column : left.entrySet()) {
            Object other = right.get(column.getKey());
            Object value = column.getValue();
            if (value instanceof BigDecimal a && other instanceof BigDecimal b) {
                if (a.compareTo(b) != 0) {
                    return false;
                }
            } else if (!Objects.equals(value, other)) {
                return false;
            }
        }
        return true;
    }

    private static final class Entry<E> {

        private final E entity;
        private final EntityMapping<E> mapping;
        private boolean stored;
        private boolean removed;
        private Map<String, Object> snapshot;

        Entry(E entity, EntityMapping<E> mapping) {
            this.entity = entity;
            this.mapping = mapping;
        }

        EntityState state() {
            if (removed) {
                return EntityState.DELETED;
            }
            if (!stored) {
                return EntityState.ADDED;
            }
            return sameColumns(snapshot, mapping.columns(entity)) ? EntityState.UNCHANGED : EntityState.MODIFIED;
        }

        void markStored() {
            stored = true;
            snapshot = mapping.columns(entity);
        }

        void clearId() {
            mapping.assignId(entity, null);
        }
    }
}

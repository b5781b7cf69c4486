package com.workforce.employees.infrastructure.persistence;

import java.util.Locale;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/** Builds the optional WHERE clause shared by the list queries. */
final class SqlFilters {

    private final StringBuilder where = new StringBuilder();
    private final MapSqlParameterSource params = new MapSqlParameterSource();

    /** Adds a case-insensitive substring match when {@code value} is not blank. */
    SqlFilters contains(String column, String param, String value) {
        if (value == null || value.isBlank()) {
            return this;
        }
        and("LOWER(" + column + ") LIKE :" + param + " ESCAPE '\\'");
        params.addValue(param, "%" + escape(value.trim().toLowerCase(Locale.ROOT)) + "%");
        return this;
    }

    /** Adds an equality match when {@code value} is not null. */
    SqlFilters equalTo(String column, String param, Object value) {
        if (value == null) {
            return this;
        }
        and(column + " = :" + param);
        params.addValue(param, value);
        return this;
    }

    /** Adds LIMIT/OFFSET for a 1-based page. */
    SqlFilters page(int pageNumber, int pageSize) {
        params.addValue("limit", pageSize);
        params.addValue("offset", (long) (pageNumber - 1) * pageSize);
        return this;
    }

    String whereClause() {
        return where.length() == 0 ? "" : " WHERE " + where;
    }

    MapSqlParameterSource params() {
        return params;
    }

    private void and(String condition) {
        if (where.length() > 0) {
            where.append(" AND ");
        }
        where.append(condition);
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}

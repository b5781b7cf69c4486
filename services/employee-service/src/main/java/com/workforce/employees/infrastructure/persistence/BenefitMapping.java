package com.workforce.employees.infrastructure.persistence;

import com.workforce.database.uow.EntityMapping;
import com.workforce.employees.domain.Benefit;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.jdbc.core.RowMapper;

/** Maps {@link Benefit} to the {@code benefits} table. */
public final class BenefitMapping implements EntityMapping<Benefit> {

    public static final BenefitMapping INSTANCE = new BenefitMapping();

    private static final RowMapper<Benefit> ROW_MAPPER = (rs, rowNum) -> new Benefit(
            rs.getLong("id"), rs.getString("name"), rs.getString("description"), rs.getBigDecimal("base_cost"));

    private BenefitMapping() {}

    @Override
    public String table() {
        return "benefits";
    }

    @Override
    public String idColumn() {
        return "id";
    }

    @Override
    public Object id(Benefit entity) {
        return entity.getId();
    }

    @Override
    public void assignId(Benefit entity, Number id) {
        entity.setId(id == null ? null : id.longValue());
    }

    @Override
    public boolean generatedId() {
        return true;
    }

    @Override
    public Map<String, Object> columns(Benefit entity) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("name", entity.getName());
        columns.put("description", entity.getDescription());
        columns.put("base_cost", entity.getBaseCost());
        return columns;
    }

    @Override
    public RowMapper<Benefit> rowMapper() {
        return ROW_MAPPER;
    }
}

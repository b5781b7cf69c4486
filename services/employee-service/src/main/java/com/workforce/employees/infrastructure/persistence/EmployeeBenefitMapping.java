package com.workforce.employees.infrastructure.persistence;

import com.workforce.database.uow.EntityMapping;
import com.workforce.employees.domain.EmployeeBenefit;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.jdbc.core.RowMapper;

/** Maps {@link EmployeeBenefit} to the {@code employee_benefits} link table. */
public final class EmployeeBenefitMapping implements EntityMapping<EmployeeBenefit> {

    public static final EmployeeBenefitMapping INSTANCE = new EmployeeBenefitMapping();

    private static final RowMapper<EmployeeBenefit> ROW_MAPPER = (rs, rowNum) -> {
        EmployeeBenefit link = new EmployeeBenefit(
                rs.getLong("employee_id"), rs.getLong("benefit_id"), rs.getBigDecimal("cost_override"));
        link.setId(rs.getLong("id"));
        return link;
    };

    private EmployeeBenefitMapping() {}

    @Override
    public String table() {
        return "employee_benefits";
    }

    @Override
    public String idColumn() {
        return "id";
    }

    @Override
    public Object id(EmployeeBenefit entity) {
        return entity.getId();
    }

    @Override
    public void assignId(EmployeeBenefit entity, Number id) {
        entity.setId(id == null ? null : id.longValue());
    }

    @Override
    public boolean generatedId() {
        return true;
    }

    @Override
    public Map<String, Object> columns(EmployeeBenefit entity) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("employee_id", entity.getEmployeeId());
        columns.put("benefit_id", entity.getBenefitId());
        columns.put("cost_override", entity.getCostOverride());
        return columns;
    }

    @Override
    public RowMapper<EmployeeBenefit> rowMapper() {
        return ROW_MAPPER;
    }
}

package com.workforce.employees.infrastructure.persistence;

import com.workforce.database.uow.EntityMapping;
import com.workforce.employees.domain.Employee;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.jdbc.core.RowMapper;

/** Maps {@link Employee} to the {@code employees} table. */
public final class EmployeeMapping implements EntityMapping<Employee> {

    public static final EmployeeMapping INSTANCE = new EmployeeMapping();

    private static final RowMapper<Employee> ROW_MAPPER = (rs, rowNum) -> {
        Employee employee = new Employee();
        employee.setId(rs.getLong("id"));
        employee.setFirstName(rs.getString("first_name"));
        employee.setLastName(rs.getString("last_name"));
        employee.setSocialSecurityNumber(rs.getString("social_security_number"));
        employee.setAddress1(rs.getString("address1"));
        employee.setAddress2(rs.getString("address2"));
        employee.setCity(rs.getString("city"));
        employee.setState(rs.getString("state"));
        employee.setZipCode(rs.getString("zip_code"));
        employee.setPhoneNumber(rs.getString("phone_number"));
        employee.setEmail(rs.getString("email"));
        employee.setCreatedBy(rs.getString("created_by"));
        employee.setCreatedAt(EntityMapping.instant(rs.getObject("created_at", OffsetDateTime.class)));
        employee.setModifiedBy(rs.getString("modified_by"));
        employee.setModifiedAt(EntityMapping.instant(rs.getObject("modified_at", OffsetDateTime.class)));
        return employee;
    };

    private EmployeeMapping() {}

    @Override
    public String table() {
        return "employees";
    }

    @Override
    public String idColumn() {
        return "id";
    }

    @Override
    public Object id(Employee entity) {
        return entity.getId();
    }

    @Override
    public void assignId(Employee entity, Number id) {
        entity.setId(id == null ? null : id.longValue());
    }

    @Override
    public boolean generatedId() {
        return true;
    }

    @Override
    public Map<String, Object> columns(Employee entity) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("first_name", entity.getFirstName());
        columns.put("last_name", entity.getLastName());
        columns.put("social_security_number", entity.getSocialSecurityNumber());
        columns.put("address1", entity.getAddress1());
        columns.put("address2", entity.getAddress2());
        columns.put("city", entity.getCity());
        columns.put("state", entity.getState());
        columns.put("zip_code", entity.getZipCode());
        columns.put("phone_number", entity.getPhoneNumber());
        columns.put("email", entity.getEmail());
        columns.put("created_by", entity.getCreatedBy());
        columns.put("created_at", EntityMapping.timestamp(entity.getCreatedAt()));
        columns.put("modified_by", entity.getModifiedBy());
        columns.put("modified_at", EntityMapping.timestamp(entity.getModifiedAt()));
        return columns;
    }

    @Override
    public RowMapper<Employee> rowMapper() {
        return ROW_MAPPER;
    }
}

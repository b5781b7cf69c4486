package com.workforce.employees.infrastructure.persistence;

import com.workforce.employees.domain.EmployeeBenefit;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Read access to benefit enrolments. */
@Repository
public class EmployeeBenefitRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public EmployeeBenefitRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<EmployeeBenefit> findByEmployeeId(long employeeId) {
        return jdbc.query("SELECT * FROM employee_benefits WHERE employee_id = :employeeId ORDER BY id",
                Map.of("employeeId", employeeId), EmployeeBenefitMapping.INSTANCE.rowMapper());
    }
}

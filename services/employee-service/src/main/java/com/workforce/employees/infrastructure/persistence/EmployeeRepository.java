package com.workforce.employees.infrastructure.persistence;

import com.workforce.employees.domain.Employee;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Read access to employees. Writes go through a unit of work. */
@Repository
public class EmployeeRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public EmployeeRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Employee> findById(long id) {
        return jdbc.query("SELECT * FROM employees WHERE id = :id", Map.of("id", id),
                        EmployeeMapping.INSTANCE.rowMapper())
                .stream()
                .findFirst();
    }

    public boolean existsById(long id) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM employees WHERE id = :id", Map.of("id", id),
                Integer.class);
        return count != null && count > 0;
    }

    /**
     * Returns one page of employees ordered by id.
     *
     * @param firstNameContains optional case-insensitive first name fragment
     * @param lastNameContains optional case-insensitive last name fragment
     * @param pageNumber 1-based page number
     * @param pageSize records per page
     */
    public List<Employee> findPage(String firstNameContains, String lastNameContains, int pageNumber, int pageSize) {
        SqlFilters filters = new SqlFilters()
                .contains("first_name", "firstName", firstNameContains)
                .contains("last_name", "lastName", lastNameContains)
                .page(pageNumber, pageSize);
        String sql = "SELECT * FROM employees" + filters.whereClause() + " ORDER BY id LIMIT :limit OFFSET :offset";
        return jdbc.query(sql, filters.params(), EmployeeMapping.INSTANCE.rowMapper());
    }
}

package com.workforce.employees.infrastructure.persistence;

import com.workforce.employees.domain.User;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Read access to users. Writes go through a unit of work. */
@Repository
public class UserRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public UserRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<User> findById(String id) {
        return jdbc.query("SELECT * FROM users WHERE id = :id", Map.of("id", id), UserMapping.INSTANCE.rowMapper())
                .stream()
                .findFirst();
    }

    /** Returns one page of users ordered by email. */
    public List<User> findPage(UserFilter filter, int pageNumber, int pageSize) {
        SqlFilters filters = new SqlFilters()
                .contains("email", "email", filter.emailContains())
                .contains("first_name", "firstName", filter.firstNameContains())
                .contains("last_name", "lastName", filter.lastNameContains())
                .equalTo("is_active", "active", filter.active())
                .page(pageNumber, pageSize);
        String sql = "SELECT * FROM users" + filters.whereClause() + " ORDER BY email, id LIMIT :limit OFFSET :offset";
        return jdbc.query(sql, filters.params(), UserMapping.INSTANCE.rowMapper());
    }

    /**
     * Optional user list filters; null or blank fields do not filter.
     *
     * @param emailContains email fragment
     * @param firstNameContains first name fragment
     * @param lastNameContains last name fragment
     * @param active activation flag
     */
    public record UserFilter(String emailContains, String firstNameContains, String lastNameContains, Boolean active) {}
}

package com.workforce.employees.infrastructure.persistence;

import com.workforce.employees.domain.Benefit;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Read access to the benefit catalogue. */
@Repository
public class BenefitRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public BenefitRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<Benefit> findAll() {
        return jdbc.query("SELECT * FROM benefits ORDER BY id", Map.of(), BenefitMapping.INSTANCE.rowMapper());
    }

    /** Returns the benefits with the given ids keyed by id; unknown ids are absent. */
    public Map<Long, Benefit> findByIds(Collection<Long> ids) {
        Map<Long, Benefit> byId = new LinkedHashMap<>();
        if (ids.isEmpty()) {
            return byId;
        }
        jdbc.query("SELECT * FROM benefits WHERE id IN (:ids) ORDER BY id", Map.of("ids", ids),
                        BenefitMapping.INSTANCE.rowMapper())
                .forEach(benefit -> byId.put(benefit.getId(), benefit));
        return byId;
    }
}

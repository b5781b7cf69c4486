package com.workforce.employees.infrastructure.persistence;

import com.workforce.database.uow.EntityMapping;
import com.workforce.employees.domain.User;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.jdbc.core.RowMapper;

/** Maps {@link User} to the {@code users} table. Ids are UUID strings assigned on creation. */
public final class UserMapping implements EntityMapping<User> {

    public static final UserMapping INSTANCE = new UserMapping();

    private static final RowMapper<User> ROW_MAPPER = (rs, rowNum) -> {
        User user = new User();
        user.setId(rs.getString("id"));
        user.setEmail(rs.getString("email"));
        user.setUserName(rs.getString("user_name"));
        user.setFirstName(rs.getString("first_name"));
        user.setLastName(rs.getString("last_name"));
        user.setProfilePicture(rs.getString("profile_picture"));
        user.setActive(rs.getBoolean("is_active"));
        user.setCreatedBy(rs.getString("created_by"));
        user.setCreatedAt(EntityMapping.instant(rs.getObject("created_at", OffsetDateTime.class)));
        user.setModifiedBy(rs.getString("modified_by"));
        user.setModifiedAt(EntityMapping.instant(rs.getObject("modified_at", OffsetDateTime.class)));
        return user;
    };

    private UserMapping() {}

    @Override
    public String table() {
        return "users";
    }

    @Override
    public String idColumn() {
        return "id";
    }

    @Override
    public Object id(User entity) {
        return entity.getId();
    }

    @Override
    public void assignId(User entity, Number id) {
        throw new UnsupportedOperationException("User ids are assigned before insert");
    }

    @Override
    public boolean generatedId() {
        return false;
    }

    @Override
    public Map<String, Object> columns(User entity) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("email", entity.getEmail());
        columns.put("user_name", entity.getUserName());
        columns.put("first_name", entity.getFirstName());
        columns.put("last_name", entity.getLastName());
        columns.put("profile_picture", entity.getProfilePicture());
        columns.put("is_active", entity.isActive());
        columns.put("created_by", entity.getCreatedBy());
        columns.put("created_at", EntityMapping.timestamp(entity.getCreatedAt()));
        columns.put("modified_by", entity.getModifiedBy());
        columns.put("modified_at", EntityMapping.timestamp(entity.getModifiedAt()));
        return columns;
    }

    @Override
    public RowMapper<User> rowMapper() {
        return ROW_MAPPER;
    }
}

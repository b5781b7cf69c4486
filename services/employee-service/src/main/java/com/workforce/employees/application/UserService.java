package com.workforce.employees.application;

import com.workforce.database.uow.UnitOfWork;
import com.workforce.database.uow.UnitOfWorkFactory;
import com.workforce.employees.domain.NotFoundException;
import com.workforce.employees.domain.User;
import com.workforce.employees.infrastructure.persistence.UserMapping;
import com.workforce.employees.infrastructure.persistence.UserRepository;
import com.workforce.employees.infrastructure.persistence.UserRepository.UserFilter;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** User profile use cases. */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private static final String RESOURCE = "User";

    private final UserRepository users;
    private final UnitOfWorkFactory unitOfWorkFactory;

    public UserService(UserRepository users, UnitOfWorkFactory unitOfWorkFactory) {
        this.users = users;
        this.unitOfWorkFactory = unitOfWorkFactory;
    }

    public List<User> list(UserFilter filter, int pageNumber, int pageSize) {
        return users.findPage(filter, pageNumber, pageSize);
    }

    public User get(String id) {
        return users.findById(id).orElseThrow(() -> new NotFoundException(RESOURCE, id));
    }

    /**
     * Stores a new, active user. The id is a fresh UUID and the user name defaults to the email.
     */
    public User create(User user) {
        user.setId(UUID.randomUUID().toString());
        if (user.getUserName() == null) {
            user.setUserName(user.getEmail());
        }
        user.setActive(true);
        UnitOfWork uow = unitOfWorkFactory.create();
        uow.add(user, UserMapping.INSTANCE);
        uow.commit();
        log.info("Created user with ID: {}", user.getId());
        return user;
    }

    /**
     * Applies {@code changes} to the stored user and writes the result.
     *
     * @throws NotFoundException if no user has this id
     */
    public User update(String id, Consumer<User> changes) {
        log.info("Updating user with ID: {}", id);
        User user = get(id);
        UnitOfWork uow = unitOfWorkFactory.create();
        uow.track(user, UserMapping.INSTANCE);
        changes.accept(user);
        uow.commit();
        return user;
    }

    /**
     * Marks a user inactive. Deactivating an inactive user changes nothing.
     *
     * @throws NotFoundException if no user has this id
     */
    public User deactivate(String id) {
        log.info("Deactivating user with ID: {}", id);
        return update(id, user -> user.setActive(false));
    }
}

package com.workforce.employees.api.users;

import com.workforce.employees.api.PagingRules;
import com.workforce.employees.application.UserService;
import com.workforce.employees.domain.User;
import com.workforce.employees.infrastructure.persistence.UserRepository.UserFilter;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/** User account endpoints. */
@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private static final int DEFAULT_RECORDS_PER_PAGE = 10;

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    public ResponseEntity<List<UserResponse>> getAllUsers(@ModelAttribute GetAllUsersRequest request) {
        UserFilter filter = new UserFilter(request.emailContains(), request.firstNameContains(),
                request.lastNameContains(), request.isActive());
        int page = PagingRules.pageOrDefault(request.page());
        int recordsPerPage = PagingRules.recordsOrDefault(request.recordsPerPage(), DEFAULT_RECORDS_PER_PAGE);
        List<UserResponse> users = userService.list(filter, page, recordsPerPage).stream()
                .map(UserResponse::from)
                .toList();
        return ResponseEntity.ok(users);
    }

    @GetMapping("/{id}")
    public ResponseEntity<UserResponse> getUserById(@PathVariable String id) {
        return ResponseEntity.ok(UserResponse.from(userService.get(id)));
    }

    @PostMapping
    public ResponseEntity<UserResponse> createUser(@RequestBody CreateUserRequest request) {
        User user = new User();
        user.setEmail(request.email());
        user.setFirstName(request.firstName());
        user.setLastName(request.lastName());
        user.setProfilePicture(request.profilePicture());

        User created = userService.create(user);
        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
                .path("/{id}")
                .buildAndExpand(created.getId())
                .toUri();
        return ResponseEntity.created(location).body(UserResponse.from(created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<UserResponse> updateUser(@PathVariable String id, @RequestBody UpdateUserRequest request) {
        User updated = userService.update(id, user -> {
            user.setFirstName(request.firstName());
            user.setLastName(request.lastName());
            user.setProfilePicture(request.profilePicture());
        });
        return ResponseEntity.ok(UserResponse.from(updated));
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<UserResponse> deactivateUser(@PathVariable String id) {
        return ResponseEntity.ok(UserResponse.from(userService.deactivate(id)));
    }
}

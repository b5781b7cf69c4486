package com.workforce.employees.api.employees;

import com.workforce.employees.api.PagingRules;
import com.workforce.employees.application.BenefitAssignmentService;
import com.workforce.employees.application.EmployeeService;
import com.workforce.employees.domain.Employee;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * Employee endpoints.
 *
 * <p>Request bodies and query objects are validated before these methods run; a handler only
 * sees payloads that passed every rule.
 */
@RestController
@RequestMapping("/api/v1/employees")
public class EmployeeController {

    private static final int DEFAULT_RECORDS_PER_PAGE = 100;

    private final EmployeeService employeeService;
    private final BenefitAssignmentService benefitAssignmentService;

    public EmployeeController(EmployeeService employeeService, BenefitAssignmentService benefitAssignmentService) {
        this.employeeService = employeeService;
        this.benefitAssignmentService = benefitAssignmentService;
    }

    @GetMapping
    public ResponseEntity<List<EmployeeResponse>> getAllEmployees(@ModelAttribute GetAllEmployeesRequest request) {
        int page = PagingRules.pageOrDefault(request.page());
        int recordsPerPage = PagingRules.recordsOrDefault(request.recordsPerPage(), DEFAULT_RECORDS_PER_PAGE);
        List<EmployeeResponse> employees = employeeService
                .list(request.firstNameContains(), request.lastNameContains(), page, recordsPerPage)
                .stream()
                .map(EmployeeResponse::from)
                .toList();
        return ResponseEntity.ok(employees);
    }

    @GetMapping("/{id}")
    public ResponseEntity<EmployeeResponse> getEmployeeById(@PathVariable long id) {
        return ResponseEntity.ok(EmployeeResponse.from(employeeService.get(id)));
    }

    @PostMapping
    public ResponseEntity<EmployeeResponse> createEmployee(@RequestBody CreateEmployeeRequest request) {
        Employee employee = new Employee();
        employee.setFirstName(request.firstName());
        employee.setLastName(request.lastName());
        employee.setSocialSecurityNumber(request.socialSecurityNumber());
        employee.setAddress1(request.address1());
        employee.setAddress2(request.address2());
        employee.setCity(request.city());
        employee.setState(request.state());
        employee.setZipCode(request.zipCode());
        employee.setPhoneNumber(request.phoneNumber());
        employee.setEmail(request.email());

        Employee created = employeeService.create(employee);
        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
                .path("/{id}")
                .buildAndExpand(created.getId())
                .toUri();
        return ResponseEntity.created(location).body(EmployeeResponse.from(created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<EmployeeResponse> updateEmployee(
            @PathVariable long id, @RequestBody UpdateEmployeeRequest request) {
        Employee updated = employeeService.update(id, employee -> {
            employee.setAddress1(request.address1());
            employee.setAddress2(request.address2());
            employee.setCity(request.city());
            employee.setState(request.state());
            employee.setZipCode(request.zipCode());
            employee.setPhoneNumber(request.phoneNumber());
            employee.setEmail(request.email());
        });
        return ResponseEntity.ok(EmployeeResponse.from(updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteEmployee(@PathVariable long id) {
        employeeService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/benefits")
    public ResponseEntity<List<EmployeeBenefitResponse>> getBenefitsForEmployee(@PathVariable long id) {
        return ResponseEntity.ok(benefitAssignmentService.benefitsOf(id).stream()
                .map(EmployeeBenefitResponse::from)
                .toList());
    }

    @PutMapping("/{id}/benefits")
    public ResponseEntity<List<EmployeeBenefitResponse>> replaceBenefits(
            @PathVariable long id, @RequestBody ReplaceBenefitsRequest request) {
        return ResponseEntity.ok(benefitAssignmentService
                .replaceAssociations(id, request.benefitIds(), request.costOverrides())
                .stream()
                .map(EmployeeBenefitResponse::from)
                .toList());
    }
}

package com.workforce.employees.application;

import com.workforce.database.uow.UnitOfWork;
import com.workforce.database.uow.UnitOfWorkFactory;
import com.workforce.employees.domain.Employee;
import com.workforce.employees.domain.NotFoundException;
import com.workforce.employees.infrastructure.persistence.EmployeeMapping;
import com.workforce.employees.infrastructure.persistence.EmployeeRepository;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Employee use cases. Every write is one audited unit of work. */
@Service
public class EmployeeService {

    private static final Logger log = LoggerFactory.getLogger(EmployeeService.class);

    static final String RESOURCE = "Employee";

    private final EmployeeRepository employees;
    private final UnitOfWorkFactory unitOfWorkFactory;

    public EmployeeService(EmployeeRepository employees, UnitOfWorkFactory unitOfWorkFactory) {
        this.employees = employees;
        this.unitOfWorkFactory = unitOfWorkFactory;
    }

    public List<Employee> list(String firstNameContains, String lastNameContains, int pageNumber, int pageSize) {
        return employees.findPage(firstNameContains, lastNameContains, pageNumber, pageSize);
    }

    public Employee get(long id) {
        return employees.findById(id).orElseThrow(() -> new NotFoundException(RESOURCE, id));
    }

    /**
     * Stores a new employee.
     *
     * @param employee the new employee, without id
     * @return the same instance with its id and creation audit fields set
     */
    public Employee create(Employee employee) {
        UnitOfWork uow = unitOfWorkFactory.create();
        uow.add(employee, EmployeeMapping.INSTANCE);
        uow.commit();
        log.info("Created employee with ID: {}", employee.getId());
        return employee;
    }

    /**
     * Applies {@code changes} to the stored employee and writes the result.
     *
     * @throws NotFoundException if no employee has this id
     */
    public Employee update(long id, Consumer<Employee> changes) {
        log.info("Updating employee with ID: {}", id);
        Employee employee = employees.findById(id).orElseThrow(() -> {
            log.info("Employee with ID: {} not found", id);
            return new NotFoundException(RESOURCE, id);
        });
        UnitOfWork uow = unitOfWorkFactory.create();
        uow.track(employee, EmployeeMapping.INSTANCE);
        changes.accept(employee);
        uow.commit();
        log.info("Employee with ID: {} successfully updated", id);
        return employee;
    }

    /**
     * Deletes an employee together with its benefit enrolments.
     *
     * @throws NotFoundException if no employee has this id
     */
    public void delete(long id) {
        Employee employee = get(id);
        UnitOfWork uow = unitOfWorkFactory.create();
        uow.remove(employee, EmployeeMapping.INSTANCE);
        uow.commit();
        log.info("Deleted employee with ID: {}", id);
    }
}

package com.workforce.employees.application;

import com.workforce.database.uow.UnitOfWork;
import com.workforce.database.uow.UnitOfWorkFactory;
import com.workforce.employees.domain.Benefit;
import com.workforce.employees.domain.EmployeeBenefit;
import com.workforce.employees.domain.NotFoundException;
import com.workforce.employees.infrastructure.persistence.BenefitRepository;
import com.workforce.employees.infrastructure.persistence.EmployeeBenefitMapping;
import com.workforce.employees.infrastructure.persistence.EmployeeBenefitRepository;
import com.workforce.employees.infrastructure.persistence.EmployeeRepository;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Manages the employee ↔ benefit enrolments.
 *
 * <p>WHY: The link table carries a unique ({@code employee_id}, {@code benefit_id}) constraint.
 * Edits replace the whole enrolment set, and the input is de-duplicated before anything is
 * written, so the constraint is only ever hit by a programming error. Such a hit surfaces as a
 * {@link com.workforce.database.uow.ConstraintViolationException} and the whole replacement rolls
 * back.
 */
@Service
public class BenefitAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(BenefitAssignmentService.class);

    private final EmployeeRepository employees;
    private final BenefitRepository benefits;
    private final EmployeeBenefitRepository enrolments;
    private final UnitOfWorkFactory unitOfWorkFactory;

    public BenefitAssignmentService(EmployeeRepository employees, BenefitRepository benefits,
                                    EmployeeBenefitRepository enrolments, UnitOfWorkFactory unitOfWorkFactory) {
        this.employees = employees;
        this.benefits = benefits;
        this.enrolments = enrolments;
        this.unitOfWorkFactory = unitOfWorkFactory;
    }

    /**
     * Returns the enrolments of an employee with their effective cost.
     *
     * @throws NotFoundException if the employee does not exist
     */
    public List<AssignedBenefit> benefitsOf(long employeeId) {
        requireEmployee(employeeId);
        List<EmployeeBenefit> links = enrolments.findByEmployeeId(employeeId);
        Map<Long, Benefit> byId = benefits.findByIds(links.stream().map(EmployeeBenefit::getBenefitId).toList());
        List<AssignedBenefit> assigned = new ArrayList<>(links.size());
        for (EmployeeBenefit link : links) {
            assigned.add(AssignedBenefit.of(link, byId.get(link.getBenefitId())));
        }
        return assigned;
    }

    /**
     * Replaces every enrolment of an employee with one enrolment per distinct id in {@code
     * benefitIds}. Existing rows are deleted and fresh rows inserted in the same commit.
     *
     * @param employeeId the employee
     * @param benefitIds the complete new set; duplicates collapse, first occurrence wins the order
     * @param costOverrides optional cost per benefit id; entries for ids not in {@code benefitIds}
     *     are ignored
     * @return the new enrolments in input order
     * @throws NotFoundException if the employee or any benefit does not exist
     */
    public List<AssignedBenefit> replaceAssociations(
            long employeeId, Collection<Long> benefitIds, Map<Long, BigDecimal> costOverrides) {
        if (benefitIds == null) {
            throw new IllegalArgumentException("benefitIds must not be null");
        }
        requireEmployee(employeeId);
        Set<Long> distinct = new LinkedHashSet<>(benefitIds);
        Map<Long, Benefit> known = benefits.findByIds(distinct);
        for (Long benefitId : distinct) {
            if (!known.containsKey(benefitId)) {
                throw new NotFoundException("Benefit", benefitId);
            }
        }
        Map<Long, BigDecimal> overrides = costOverrides == null ? Map.of() : costOverrides;

        UnitOfWork uow = unitOfWorkFactory.create();
        for (EmployeeBenefit existing : enrolments.findByEmployeeId(employeeId)) {
            uow.remove(existing, EmployeeBenefitMapping.INSTANCE);
        }
        List<AssignedBenefit> assigned = new ArrayList<>(distinct.size());
        for (Long benefitId : distinct) {
            EmployeeBenefit enrolment = new EmployeeBenefit(employeeId, benefitId, overrides.get(benefitId));
            EmployeeBenefit link = uow.add(enrolment, EmployeeBenefitMapping.INSTANCE);
            assigned.add(AssignedBenefit.of(link, known.get(benefitId)));
        }
        uow.commit();
        log.info("Replaced benefits of employee {} with {}", employeeId, distinct);
        return assigned;
    }

    private void requireEmployee(long employeeId) {
        if (!employees.existsById(employeeId)) {
            throw new NotFoundException(EmployeeService.RESOURCE, employeeId);
        }
    }
}

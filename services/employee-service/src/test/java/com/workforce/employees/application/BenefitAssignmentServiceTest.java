package com.workforce.employees.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.workforce.database.uow.UnitOfWork;
import com.workforce.employees.domain.Benefit;
import com.workforce.employees.domain.EmployeeBenefit;
import com.workforce.employees.domain.NotFoundException;
import com.workforce.employees.infrastructure.persistence.BenefitRepository;
import com.workforce.employees.infrastructure.persistence.EmployeeBenefitMapping;
import com.workforce.employees.infrastructure.persistence.EmployeeBenefitRepository;
import com.workforce.employees.infrastructure.persistence.EmployeeRepository;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

@DisplayName("BenefitAssignmentService")
class BenefitAssignmentServiceTest {

    private static final long EMPLOYEE = 7L;

    private final Benefit health = new Benefit(1L, "Health", null, new BigDecimal("100.00"));
    private final Benefit dental = new Benefit(2L, "Dental", null, new BigDecimal("50.00"));
    private final Benefit vision = new Benefit(3L, "Vision", null, new BigDecimal("30.00"));

    private EmployeeRepository employees;
    private BenefitRepository benefits;
    private EmployeeBenefitRepository enrolments;
    private UnitOfWork uow;
    private BenefitAssignmentService service;

    @BeforeEach
    void setUp() {
        employees = mock(EmployeeRepository.class);
        benefits = mock(BenefitRepository.class);
        enrolments = mock(EmployeeBenefitRepository.class);
        uow = mock(UnitOfWork.class);
        service = new BenefitAssignmentService(employees, benefits, enrolments, () -> uow);

        when(employees.existsById(EMPLOYEE)).thenReturn(true);
        when(benefits.findByIds(anyCollection()))
                .thenAnswer(
                        invocation -> {
                            Collection<Long> ids = invocation.getArgument(0);
                            Map<Long, Benefit> found = new LinkedHashMap<>();
                            for (Benefit benefit : List.of(health, dental, vision)) {
                                if (ids.contains(benefit.getId())) {
                                    found.put(benefit.getId(), benefit);
                                }
                            }
                            return found;
                        });
        when(uow.add(any(EmployeeBenefit.class), eq(EmployeeBenefitMapping.INSTANCE)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static EmployeeBenefit stored(long id, long benefitId, BigDecimal override) {
        EmployeeBenefit link = new EmployeeBenefit(EMPLOYEE, benefitId, override);
        link.setId(id);
        return link;
    }

    @Nested
    @DisplayName("replaceAssociations")
    class ReplaceAssociations {

        @Test
        @DisplayName("removes every existing link before adding the new set, then commits once")
        void removesThenAdds() {
            EmployeeBenefit oldHealth = stored(10L, 1L, null);
            EmployeeBenefit oldDental = stored(11L, 2L, null);
            when(enrolments.findByEmployeeId(EMPLOYEE)).thenReturn(List.of(oldHealth, oldDental));

            List<AssignedBenefit> result =
                    service.replaceAssociations(EMPLOYEE, List.of(2L, 3L), Map.of());

            InOrder order = inOrder(uow);
            order.verify(uow).remove(oldHealth, EmployeeBenefitMapping.INSTANCE);
            order.verify(uow).remove(oldDental, EmployeeBenefitMapping.INSTANCE);
            order.verify(uow).add(argThat(link -> link.getBenefitId() == 2L), eq(EmployeeBenefitMapping.INSTANCE));
            order.verify(uow).add(argThat(link -> link.getBenefitId() == 3L), eq(EmployeeBenefitMapping.INSTANCE));
            order.verify(uow).commit();
            assertThat(result)
                    .extracting(a -> a.benefit().getName(), AssignedBenefit::effectiveCost)
                    .containsExactly(
                            tuple("Dental", new BigDecimal("50.00")),
                            tuple("Vision", new BigDecimal("30.00")));
        }

        @Test
        @DisplayName("collapses duplicate ids into one link")
        void collapsesDuplicates() {
            when(enrolments.findByEmployeeId(EMPLOYEE)).thenReturn(List.of());

            List<AssignedBenefit> result =
                    service.replaceAssociations(EMPLOYEE, List.of(2L, 2L), null);

            assertThat(result).hasSize(1);
            assertThat(result.get(0).enrolment().getBenefitId()).isEqualTo(2L);
        }

        @Test
        @DisplayName("applies overrides only to listed benefits")
        void appliesOverrides() {
            when(enrolments.findByEmployeeId(EMPLOYEE)).thenReturn(List.of());

            List<AssignedBenefit> result =
                    service.replaceAssociations(
                            EMPLOYEE,
                            List.of(1L, 2L),
                            Map.of(1L, new BigDecimal("60.00"), 3L, new BigDecimal("5.00")));

            assertThat(result)
                    .extracting(a -> a.benefit().getName(), AssignedBenefit::effectiveCost)
                    .containsExactly(
                            tuple("Health", new BigDecimal("60.00")),
                            tuple("Dental", new BigDecimal("50.00")));
        }

        @Test
        @DisplayName("an empty list removes every link")
        void emptyListClearsLinks() {
            EmployeeBenefit oldHealth = stored(10L, 1L, null);
            when(enrolments.findByEmployeeId(EMPLOYEE)).thenReturn(List.of(oldHealth));

            assertThat(service.replaceAssociations(EMPLOYEE, List.of(), Map.of())).isEmpty();

            verify(uow).remove(oldHealth, EmployeeBenefitMapping.INSTANCE);
            verify(uow).commit();
        }

        @Test
        @DisplayName("an unknown benefit id is NotFound and nothing is written")
        void unknownBenefit() {
            assertThatThrownBy(() -> service.replaceAssociations(EMPLOYEE, List.of(1L, 99L), null))
                    .isInstanceOf(NotFoundException.class)
                    .satisfies(
                            e -> {
                                assertThat(((NotFoundException) e).resource()).isEqualTo("Benefit");
                                assertThat(((NotFoundException) e).id()).isEqualTo(99L);
                            });
            verify(uow, never()).commit();
        }

        @Test
        @DisplayName("an unknown employee is NotFound")
        void unknownEmployee() {
            assertThatThrownBy(() -> service.replaceAssociations(99L, List.of(1L), null))
                    .isInstanceOf(NotFoundException.class)
                    .hasMessageContaining("Employee 99");
            verify(uow, never()).commit();
        }
    }

    @Nested
    @DisplayName("benefitsOf")
    class BenefitsOf {

        @Test
        @DisplayName("joins each link with its benefit and computes the effective cost")
        void joinsLinks() {
            when(enrolments.findByEmployeeId(EMPLOYEE))
                    .thenReturn(
                            List.of(stored(10L, 1L, new BigDecimal("60.00")), stored(11L, 2L, null)));

            assertThat(service.benefitsOf(EMPLOYEE))
                    .extracting(a -> a.benefit().getName(), AssignedBenefit::effectiveCost)
                    .containsExactly(
                            tuple("Health", new BigDecimal("60.00")),
                            tuple("Dental", new BigDecimal("50.00")));
        }

        @Test
        @DisplayName("an unknown employee is NotFound")
        void unknownEmployee() {
            assertThatThrownBy(() -> service.benefitsOf(99L)).isInstanceOf(NotFoundException.class);
        }
    }
}

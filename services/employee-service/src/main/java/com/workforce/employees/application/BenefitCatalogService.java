package com.workforce.employees.application;

import com.workforce.employees.domain.Benefit;
import com.workforce.employees.infrastructure.persistence.BenefitRepository;
import java.util.List;
import org.springframework.stereotype.Service;

/** Read access to the benefits on offer. */
@Service
public class BenefitCatalogService {

    private final BenefitRepository benefits;

    public BenefitCatalogService(BenefitRepository benefits) {
        this.benefits = benefits;
    }

    public List<Benefit> list() {
        return benefits.findAll();
    }
}

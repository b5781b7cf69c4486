package com.workforce.employees.api.benefits;

import com.workforce.employees.application.BenefitCatalogService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read-only benefit catalogue. */
@RestController
@RequestMapping("/api/v1/benefits")
public class BenefitController {

    private final BenefitCatalogService catalog;

    public BenefitController(BenefitCatalogService catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public ResponseEntity<List<BenefitResponse>> getAllBenefits() {
        return ResponseEntity.ok(catalog.list().stream().map(BenefitResponse::from).toList());
    }
}

package com.workforce.employees.domain;

import java.math.BigDecimal;

/** A benefit offered to employees, with its catalogue cost. */
public class Benefit {

    private Long id;
    private String name;
    private String description;
    private BigDecimal baseCost;

    public Benefit() {}

    public Benefit(Long id, String name, String description, BigDecimal baseCost) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.baseCost = baseCost;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public BigDecimal getBaseCost() {
        return baseCost;
    }

    public void setBaseCost(BigDecimal baseCost) {
        this.baseCost = baseCost;
    }
}

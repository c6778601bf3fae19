package com.example.conservation.etl.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.util.List;

/**
 * Form 990 summary for one fiscal year. Any measure may be null when its label
 * could not be located in the filing.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class FinancialFilingFact extends FactRecord {
    private Integer fiscalYear;
    private Integer taxYear;
    private String ein;
    private String organizationName;

    // Revenue
    private BigDecimal contributionsAndGrants;
    private BigDecimal programServiceRevenue;
    private BigDecimal investmentIncome;
    private BigDecimal otherRevenue;
    private BigDecimal totalRevenue;

    // Expenses
    private BigDecimal grantsAndSimilarPaid;
    private BigDecimal salariesAndWages;
    private BigDecimal totalExpenses;
    private BigDecimal revenueLessExpenses;
    private BigDecimal programServicesExpenses;

    // Balance sheet
    private BigDecimal totalAssets;
    private BigDecimal totalLiabilities;
    private BigDecimal netAssets;

    private Integer employeesCount;
    private Integer volunteersCount;

    @Override
    public EntityType getEntityType() {
        return EntityType.FINANCIAL_FILING;
    }

    @Override
    public String getNaturalKey() {
        return fiscalYear == null ? null : fiscalYear.toString();
    }

    @Override
    public List<ForeignKeyRef> getForeignKeys() {
        return List.of();
    }
}

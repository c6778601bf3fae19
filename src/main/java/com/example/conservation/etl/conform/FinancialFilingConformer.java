package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.FinancialFilingFact;
import com.example.conservation.etl.model.StagedRecord;
import com.example.conservation.etl.model.ValidationResult;
import com.example.conservation.etl.model.ViolationCategory;
import com.example.conservation.etl.reader.FilingDocumentSourceReader;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conforms the Form 990 summary of one filing. Labels the reader could not find stay null
 * and are raised as warnings, so the filing still loads.
 */
@Component
public class FinancialFilingConformer implements EntityConformer<FinancialFilingFact> {
    private final TypeCoercer coercer;

    public FinancialFilingConformer(TypeCoercer coercer) {
        this.coercer = coercer;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.FINANCIAL_FILING;
    }

    @Override
    public FinancialFilingFact conform(StagedRecord staged, DimensionLookups lookups) {
        FinancialFilingFact filing = new FinancialFilingFact();
        filing.setTaxYear(coercer.toInteger(staged, "tax_year"));
        Integer fiscalYear = coercer.toInteger(staged, "fiscal_year");
        filing.setFiscalYear(fiscalYear != null ? fiscalYear : filing.getTaxYear());
        filing.setEin(coercer.toText(staged, "ein"));
        filing.setOrganizationName(coercer.toText(staged, "organization_name"));

        filing.setContributionsAndGrants(coercer.toDecimal(staged, "contributions_and_grants"));
        filing.setProgramServiceRevenue(coercer.toDecimal(staged, "program_service_revenue"));
        filing.setInvestmentIncome(coercer.toDecimal(staged, "investment_income"));
        filing.setOtherRevenue(coercer.toDecimal(staged, "other_revenue"));
        filing.setTotalRevenue(coercer.toDecimal(staged, "total_revenue"));

        filing.setGrantsAndSimilarPaid(coercer.toDecimal(staged, "grants_and_similar_paid"));
        filing.setSalariesAndWages(coercer.toDecimal(staged, "salaries_and_wages"));
        filing.setTotalExpenses(coercer.toDecimal(staged, "total_expenses"));
        filing.setRevenueLessExpenses(coercer.toDecimal(staged, "revenue_less_expenses"));
        if (filing.getRevenueLessExpenses() == null && filing.getTotalRevenue() != null && filing.getTotalExpenses() != null) {
            filing.setRevenueLessExpenses(filing.getTotalRevenue().subtract(filing.getTotalExpenses()));
        }
        filing.setProgramServicesExpenses(programServicesExpenses(staged));

        filing.setTotalAssets(coercer.toDecimal(staged, "total_assets"));
        filing.setTotalLiabilities(coercer.toDecimal(staged, "total_liabilities"));
        filing.setNetAssets(coercer.toDecimal(staged, "net_assets"));

        filing.setEmployeesCount(coercer.toInteger(staged, "employees_count"));
        filing.setVolunteersCount(coercer.toInteger(staged, "volunteers_count"));

        Integer year = filing.getTaxYear() != null ? filing.getTaxYear() : filing.getFiscalYear();
        if (year != null) {
            filing.setBusinessDate(LocalDate.of(year, 12, 31));
        }
        return filing;
    }

    @Override
    public List<ValidationResult> warnings(StagedRecord staged, FinancialFilingFact conformed) {
        Object missing = staged.getValue(FilingDocumentSourceReader.MISSING_LABELS);
        if (!(missing instanceof List<?>)) {
            return List.of();
        }
        List<ValidationResult> warnings = new ArrayList<>();
        for (Object label : (List<?>) missing) {
            warnings.add(ValidationResult.warning(EntityType.FINANCIAL_FILING, staged.getSourceRef(),
                    "filing-label-missing", ViolationCategory.COMPLETENESS,
                    "Label for '" + label + "' not found; field left empty for review"));
        }
        return warnings;
    }

    /**
     * Sum of the Part III program line expenses, or null when the filing lists none.
     */
    private BigDecimal programServicesExpenses(StagedRecord staged) {
        Object lines = staged.getValue(FilingDocumentSourceReader.PROGRAM_SERVICES);
        if (!(lines instanceof List<?>) || ((List<?>) lines).isEmpty()) {
            return null;
        }
        BigDecimal total = BigDecimal.ZERO;
        int index = 0;
        for (Object line : (List<?>) lines) {
            index++;
            if (line instanceof Map) {
                StagedRecord programLine = new StagedRecord(staged.getSourceRef() + "." + index, stringKeys((Map<?, ?>) line));
                BigDecimal expenses = coercer.toDecimal(programLine, "expenses");
                if (expenses != null) {
                    total = total.add(expenses);
                }
            }
        }
        return total;
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}

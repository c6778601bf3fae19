package com.example.conservation.etl.quality;

import com.example.conservation.etl.model.FinancialFilingFact;
import com.example.conservation.etl.model.Severity;
import com.example.conservation.etl.model.ViolationCategory;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Total revenue should equal the sum of the four revenue lines. Only checked when all five are present.
 */
public class RevenueReconciliationRule extends RecordRule<FinancialFilingFact> {

    private final BigDecimal tolerance;

    public RevenueReconciliationRule(BigDecimal tolerance) {
        super("revenue-reconciles", ViolationCategory.BUSINESS_RULE, Severity.WARNING);
        this.tolerance = tolerance;
    }

    @Override
    protected Optional<String> check(FinancialFilingFact filing) {
        if (Stream.of(filing.getContributionsAndGrants(), filing.getProgramServiceRevenue(), filing.getInvestmentIncome(),
                filing.getOtherRevenue(), filing.getTotalRevenue()).anyMatch(v -> v == null)) {
            return Optional.empty();
        }
        BigDecimal lines = filing.getContributionsAndGrants()
                .add(filing.getProgramServiceRevenue())
                .add(filing.getInvestmentIncome())
                .add(filing.getOtherRevenue());
        if (lines.subtract(filing.getTotalRevenue()).abs().compareTo(tolerance) > 0) {
            return Optional.of("Revenue lines sum to " + lines.toPlainString() + " but total revenue is "
                    + filing.getTotalRevenue().toPlainString());
        }
        return Optional.empty();
    }
}

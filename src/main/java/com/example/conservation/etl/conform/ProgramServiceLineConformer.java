package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.ProgramServiceLineFact;
import com.example.conservation.etl.model.StagedRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Conforms a Part III program line. Input is the filing record flattened on
 * {@code program_services}; the fiscal year comes from the enclosing filing.
 */
@Component
public class ProgramServiceLineConformer implements EntityConformer<ProgramServiceLineFact> {
    private final TypeCoercer coercer;

    public ProgramServiceLineConformer(TypeCoercer coercer) {
        this.coercer = coercer;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.PROGRAM_SERVICE_LINE;
    }

    @Override
    public ProgramServiceLineFact conform(StagedRecord staged, DimensionLookups lookups) {
        ProgramServiceLineFact line = new ProgramServiceLineFact();
        Integer fiscalYear = coercer.toInteger(staged, "fiscal_year");
        line.setFiscalYear(fiscalYear != null ? fiscalYear : coercer.toInteger(staged, "tax_year"));
        line.setProgramCode(coercer.toText(staged, "program_code"));
        line.setProgramName(coercer.toText(staged, "program_name"));
        line.setExpenses(coercer.toDecimal(staged, "expenses"));
        line.setGrants(coercer.toDecimal(staged, "grants"));
        line.setRevenue(coercer.toDecimal(staged, "revenue"));
        if (line.getFiscalYear() != null) {
            line.setBusinessDate(LocalDate.of(line.getFiscalYear(), 12, 31));
        }
        return line;
    }
}

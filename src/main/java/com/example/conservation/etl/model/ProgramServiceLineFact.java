package com.example.conservation.etl.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class ProgramServiceLineFact extends FactRecord {
    private Integer fiscalYear;
    private String programCode;
    private String programName;
    private BigDecimal expenses;
    private BigDecimal grants;
    private BigDecimal revenue;

    @Override
    public EntityType getEntityType() {
        return EntityType.PROGRAM_SERVICE_LINE;
    }

    @Override
    public String getNaturalKey() {
        return fiscalYear + "|" + programName;
    }

    @Override
    public List<ForeignKeyRef> getForeignKeys() {
        return List.of();
    }
}

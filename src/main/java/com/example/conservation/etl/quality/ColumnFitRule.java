package com.example.conservation.etl.quality;

import com.example.conservation.etl.load.TableDefinition;
import com.example.conservation.etl.model.ConformedRecord;
import com.example.conservation.etl.model.Severity;
import com.example.conservation.etl.model.ViolationCategory;

import java.util.List;
import java.util.Optional;

/**
 * Blocks a record whose text or decimal values exceed the declared sizes of its store columns,
 * so that one oversized value excludes its record instead of failing the entity's whole load.
 */
public class ColumnFitRule<T extends ConformedRecord> extends RecordRule<T> {

    private final TableDefinition<?> table;

    public ColumnFitRule(TableDefinition<?> table) {
        super("column-fit", ViolationCategory.CONFORMANCE, Severity.BLOCKING);
        this.table = table;
    }

    @Override
    protected Optional<String> check(T record) {
        List<String> misfits = table.misfits(record);
        if (misfits.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("Does not fit " + table.getTableName() + ": " + String.join("; ", misfits));
    }
}

package com.example.conservation.etl.reader;

import com.example.conservation.etl.model.StagedRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Flattens one level of a nested collection into repeated records that share the parent's fields.
 * Object elements are merged into the parent (parent fields win on a name clash); scalar elements
 * replace the collection under the same field name.
 */
public final class RecordFlattener {

    private RecordFlattener() {
    }

    public static Stream<StagedRecord> flatten(StagedRecord parent, String field, boolean keepEmpty) {
        Object nested = parent.getValue(field);
        List<?> elements = asList(nested);

        if (elements.isEmpty()) {
            if (!keepEmpty) {
                return Stream.empty();
            }
            Map<String, Object> data = new LinkedHashMap<>(parent.getData());
            data.put(field, null);
            return Stream.of(new StagedRecord(parent.getSourceRef(), data));
        }

        List<StagedRecord> children = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            Object element = elements.get(i);
            Map<String, Object> data = new LinkedHashMap<>();
            if (element instanceof Map) {
                ((Map<?, ?>) element).forEach((k, v) -> data.put(String.valueOf(k), v));
                data.putAll(parent.getData());
                data.remove(field);
            } else {
                data.putAll(parent.getData());
                data.put(field, element);
            }
            children.add(new StagedRecord(parent.getSourceRef() + "." + (i + 1), data));
        }
        return children.stream();
    }

    private static List<?> asList(Object nested) {
        if (nested == null) {
            return List.of();
        }
        if (nested instanceof List) {
            return (List<?>) nested;
        }
        if (nested instanceof Collection) {
            return new ArrayList<>((Collection<?>) nested);
        }
        return List.of(nested);
    }
}

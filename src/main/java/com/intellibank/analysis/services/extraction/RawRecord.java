package com.intellibank.analysis.services.extraction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One data row as found in the document, before any interpretation.
 *
 * @param rowIndex   position among the data rows of the document, starting at 0
 * @param sourceLine 1-based line or row number in the source file, for diagnostics
 * @param fields     verbatim text per recognized column
 * @param cells      all cells of the row, in column order
 */
public record RawRecord(int rowIndex, int sourceLine, Map<RawColumn, String> fields, List<String> cells) {

    public RawRecord {
        Map<RawColumn, String> copy = new EnumMap<>(RawColumn.class);
        if (fields != null) copy.putAll(fields);
        fields = Collections.unmodifiableMap(copy);
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    public String field(RawColumn column) {
        return fields.get(column);
    }

    public boolean hasValue(RawColumn column) {
        String v = fields.get(column);
        return v != null && !v.isBlank();
    }
}

package com.intellibank.analysis.services.extraction;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntUnaryOperator;

/**
 * Finds the header row of a tabular statement and maps its cells to {@link RawColumn}s.
 *
 * A row qualifies as header when it names a date column, a description column and at least one of
 * amount / debit / credit. Exact label matches win over word containment ("Amount (USD)").
 */
public final class HeaderLocator {

    private static final int MAX_CONTAINMENT_WORDS = 4;

    private HeaderLocator() {}

    public record HeaderMatch(int rowPosition, Map<RawColumn, Integer> columns) {
        public HeaderMatch {
            columns = Collections.unmodifiableMap(new EnumMap<>(columns));
        }
    }

    /**
     * Scans at most {@code window} rows from the top.
     */
    public static Optional<HeaderMatch> locate(List<List<String>> rows, int window) {
        int limit = Math.min(rows.size(), Math.max(window, 0));
        for (int i = 0; i < limit; i++) {
            Map<RawColumn, Integer> columns = resolveColumns(rows.get(i));
            if (isComplete(columns)) {
                return Optional.of(new HeaderMatch(i, columns));
            }
        }
        return Optional.empty();
    }

    public static boolean isComplete(Map<RawColumn, Integer> columns) {
        return columns.containsKey(RawColumn.DATE)
                && columns.containsKey(RawColumn.DESCRIPTION)
                && (columns.containsKey(RawColumn.AMOUNT)
                        || columns.containsKey(RawColumn.DEBIT)
                        || columns.containsKey(RawColumn.CREDIT));
    }

    public static Map<RawColumn, Integer> resolveColumns(List<String> cells) {
        Map<RawColumn, Integer> columns = new EnumMap<>(RawColumn.class);
        if (cells == null || cells.isEmpty()) return columns;

        List<String> normalized = new ArrayList<>(cells.size());
        for (String c : cells) normalized.add(normalizeLabel(c));
        boolean[] taken = new boolean[cells.size()];

        // 1) exact labels
        for (int i = 0; i < normalized.size(); i++) {
            String cell = normalized.get(i);
            if (cell.isEmpty()) continue;
            for (RawColumn column : RawColumn.values()) {
                if (!columns.containsKey(column) && column.labels().contains(cell)) {
                    columns.put(column, i);
                    taken[i] = true;
                    break;
                }
            }
        }

        // 2) label contained as whole words in a short cell
        for (int i = 0; i < normalized.size(); i++) {
            String cell = normalized.get(i);
            if (taken[i] || cell.isEmpty() || cell.split(" ").length > MAX_CONTAINMENT_WORDS) continue;
            String padded = " " + cell + " ";
            for (RawColumn column : RawColumn.values()) {
                if (columns.containsKey(column)) continue;
                boolean hit = column.labels().stream().anyMatch(l -> padded.contains(" " + l + " "));
                if (hit) {
                    columns.put(column, i);
                    taken[i] = true;
                    break;
                }
            }
        }
        return columns;
    }

    /**
     * Turns the rows following the header into records. Blank rows and repeated header rows are
     * skipped; {@code sourceLineOf} maps a row position to its 1-based line in the source file.
     */
    public static List<RawRecord> recordsAfter(List<List<String>> rows, HeaderMatch header,
                                               IntUnaryOperator sourceLineOf) {
        List<RawRecord> records = new ArrayList<>();
        int rowIndex = 0;
        for (int i = header.rowPosition() + 1; i < rows.size(); i++) {
            List<String> cells = rows.get(i);
            if (isBlank(cells)) continue;
            if (isComplete(resolveColumns(cells))) continue;

            Map<RawColumn, String> fields = new EnumMap<>(RawColumn.class);
            for (Map.Entry<RawColumn, Integer> e : header.columns().entrySet()) {
                int idx = e.getValue();
                if (idx < cells.size()) {
                    fields.put(e.getKey(), cells.get(idx) == null ? "" : cells.get(idx).trim());
                }
            }
            records.add(new RawRecord(rowIndex++, sourceLineOf.applyAsInt(i), fields, cells));
        }
        return records;
    }

    public static String normalizeLabel(String input) {
        if (input == null) return "";
        String s = input.trim().toLowerCase(Locale.ROOT);
        s = Normalizer.normalize(s, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        s = s.replace('\u00A0', ' ');
        s = s.replaceAll("[^a-z0-9]+", " ");
        return s.replaceAll("\\s+", " ").trim();
    }

    static boolean isBlank(List<String> cells) {
        if (cells == null) return true;
        for (String c : cells) {
            if (c != null && !c.isBlank()) return false;
        }
        return true;
    }
}

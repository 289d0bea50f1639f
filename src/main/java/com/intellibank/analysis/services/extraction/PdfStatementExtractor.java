package com.intellibank.analysis.services.extraction;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

import com.intellibank.analysis.config.AnalysisProperties;
import com.intellibank.analysis.enums.StatementFormat;
import com.intellibank.analysis.exceptions.CorruptInputException;
import com.intellibank.analysis.exceptions.SchemaNotFoundException;
import com.intellibank.analysis.services.extraction.PositionalTextStripper.Token;

import lombok.extern.slf4j.Slf4j;

/**
 * Rebuilds the transaction table of a text-based PDF statement from token positions.
 *
 * The header line fixes the column layout. A token lying under a money column's label belongs to
 * that column whatever its text; the amount parser judges it later. Amount-looking tokens that
 * drifted out of the label's span go to the nearest money column, and a detached CR/DR marker
 * follows the amount before it. Other tokens go to the text column whose left edge precedes them.
 *
 * Every line whose date cell reads as a date starts a record, with or without a usable amount, so
 * bad rows are counted downstream instead of lost here. Description-only lines continue the
 * previous record; anything else is page furniture.
 */
@Component
@Slf4j
public class PdfStatementExtractor implements StatementExtractor {

    private static final Pattern MONEY_TOKEN =
            Pattern.compile("^[-+(]?\\p{Sc}?[-(]?\\d[\\d.,']*[.,]\\d{2}\\)?-?$");

    private static final Pattern SIGN_MARKER = Pattern.compile("(?i)^(CR|DR)\\.?$");

    private static final Pattern DATE_LIKE = Pattern.compile(
            "(?i).*(\\d{1,4}[-/.]\\d{1,2}|\\d{1,2}[ -]?(jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)"
                    + "|(jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\.?[ -]?\\d{1,2}|\\b\\d{8}\\b).*");

    private static final float HEADER_WORD_GAP_FACTOR = 1.5f;
    private static final float MONEY_COLUMN_SLACK = 20f;
    private static final float TEXT_COLUMN_TOLERANCE = 2f;

    private final AnalysisProperties properties;

    public PdfStatementExtractor(AnalysisProperties properties) {
        this.properties = properties;
    }

    @Override
    public StatementFormat format() {
        return StatementFormat.PDF;
    }

    @Override
    public List<RawRecord> extract(byte[] fileBytes) {
        if (fileBytes == null || fileBytes.length == 0) {
            throw new CorruptInputException("PDF file is empty");
        }

        List<List<Token>> lines;
        try (PDDocument document = PDDocument.load(fileBytes)) {
            lines = new PositionalTextStripper().readLines(document);
        } catch (IOException e) {
            throw new CorruptInputException("Unreadable PDF document: " + e.getMessage(), e);
        }

        if (lines.isEmpty()) {
            throw new SchemaNotFoundException("PDF has no text layer; scanned statements are not supported");
        }

        int window = properties.extraction().headerScanWindow();
        Layout layout = locateHeader(lines, window);
        if (layout == null) {
            throw new SchemaNotFoundException(
                    "PDF header with date, description and amount not found in the first " + window + " lines");
        }

        List<RawRecord> records = readRecords(lines, layout);
        log.info("[PdfExtractor] headerLine={} columns={} lines={} records={}",
                layout.linePosition + 1, layout.columns.keySet(), lines.size(), records.size());
        return records;
    }

    private static Layout locateHeader(List<List<Token>> lines, int window) {
        int limit = Math.min(lines.size(), window);
        for (int i = 0; i < limit; i++) {
            Layout layout = layoutOf(lines.get(i), i);
            if (layout != null) return layout;
        }
        return null;
    }

    private static Layout layoutOf(List<Token> line, int position) {
        List<Token> cells = mergeIntoCells(line);
        List<String> labels = new ArrayList<>(cells.size());
        for (Token c : cells) labels.add(c.text());

        Map<RawColumn, Integer> resolved = HeaderLocator.resolveColumns(labels);
        if (!HeaderLocator.isComplete(resolved)) return null;

        Map<RawColumn, Token> columns = new EnumMap<>(RawColumn.class);
        resolved.forEach((column, idx) -> columns.put(column, cells.get(idx)));
        return new Layout(position, columns);
    }

    /**
     * Joins tokens separated by roughly one space into a single header cell ("Posted Date").
     */
    private static List<Token> mergeIntoCells(List<Token> line) {
        List<Token> cells = new ArrayList<>();
        Token open = null;
        for (Token t : line) {
            if (open != null) {
                float gap = t.xStart() - open.xEnd();
                float limit = HEADER_WORD_GAP_FACTOR * Math.max(open.charWidth(), t.charWidth());
                if (gap <= limit) {
                    open = new Token(open.text() + " " + t.text(), open.xStart(), t.xEnd(),
                            (open.charWidth() + t.charWidth()) / 2f);
                    continue;
                }
                cells.add(open);
            }
            open = t;
        }
        if (open != null) cells.add(open);
        return cells;
    }

    private static List<RawRecord> readRecords(List<List<Token>> lines, Layout layout) {
        List<RawRecord> records = new ArrayList<>();
        PendingRow pending = null;

        for (int i = layout.linePosition + 1; i < lines.size(); i++) {
            List<Token> line = lines.get(i);
            if (layoutOf(line, i) != null) continue; // header repeated on a later page

            Map<RawColumn, String> fields = assign(line, layout);
            String date = fields.get(RawColumn.DATE);

            if (notBlank(date) && DATE_LIKE.matcher(date).matches()) {
                if (pending != null) records.add(pending.toRecord(records.size(), layout));
                pending = new PendingRow(i + 1, fields);
            } else if (pending != null && isContinuation(fields)) {
                pending.appendDescription(fields.get(RawColumn.DESCRIPTION));
            } else if (pending != null) {
                records.add(pending.toRecord(records.size(), layout));
                pending = null;
            }
        }
        if (pending != null) records.add(pending.toRecord(records.size(), layout));
        return records;
    }

    private static boolean isContinuation(Map<RawColumn, String> fields) {
        if (!notBlank(fields.get(RawColumn.DESCRIPTION))) return false;
        for (Map.Entry<RawColumn, String> e : fields.entrySet()) {
            if (e.getKey() != RawColumn.DESCRIPTION && notBlank(e.getValue())) return false;
        }
        return true;
    }

    private static Map<RawColumn, String> assign(List<Token> line, Layout layout) {
        Map<RawColumn, StringBuilder> buffers = new EnumMap<>(RawColumn.class);
        RawColumn previous = null;
        for (Token token : line) {
            RawColumn target = moneyColumnUnder(token, layout);
            if (target == null && previous != null && previous.isMoney()
                    && SIGN_MARKER.matcher(token.text()).matches()) {
                target = previous;
            }
            if (target == null && MONEY_TOKEN.matcher(token.text()).matches()) {
                target = nearestMoneyColumn(token, layout);
            }
            if (target == null) {
                target = textColumn(token, layout);
            }
            if (target == null) continue;
            StringBuilder sb = buffers.computeIfAbsent(target, k -> new StringBuilder());
            if (sb.length() > 0) sb.append(' ');
            sb.append(token.text());
            previous = target;
        }
        Map<RawColumn, String> fields = new EnumMap<>(RawColumn.class);
        buffers.forEach((k, v) -> fields.put(k, v.toString()));
        return fields;
    }

    /**
     * The money column whose label span, widened by {@link #MONEY_COLUMN_SLACK}, overlaps the token.
     */
    private static RawColumn moneyColumnUnder(Token token, Layout layout) {
        RawColumn best = null;
        float bestDistance = Float.MAX_VALUE;
        for (Map.Entry<RawColumn, Token> e : layout.columns.entrySet()) {
            if (!e.getKey().isMoney()) continue;
            Token header = e.getValue();
            boolean overlaps = token.xEnd() >= header.xStart() - MONEY_COLUMN_SLACK
                    && token.xStart() <= header.xEnd() + MONEY_COLUMN_SLACK;
            if (!overlaps) continue;
            float distance = Math.abs(token.center() - header.center());
            if (distance < bestDistance) {
                bestDistance = distance;
                best = e.getKey();
            }
        }
        return best;
    }

    private static RawColumn nearestMoneyColumn(Token token, Layout layout) {
        RawColumn best = null;
        float bestDistance = Float.MAX_VALUE;
        for (Map.Entry<RawColumn, Token> e : layout.columns.entrySet()) {
            if (!e.getKey().isMoney()) continue;
            Token header = e.getValue();
            if (token.xEnd() < header.xStart() - MONEY_COLUMN_SLACK) continue;
            float distance = Math.abs(token.center() - header.center());
            if (distance < bestDistance) {
                bestDistance = distance;
                best = e.getKey();
            }
        }
        return best;
    }

    private static RawColumn textColumn(Token token, Layout layout) {
        RawColumn best = null;
        float bestStart = -Float.MAX_VALUE;
        RawColumn leftmost = null;
        float leftmostStart = Float.MAX_VALUE;
        for (Map.Entry<RawColumn, Token> e : layout.columns.entrySet()) {
            if (e.getKey().isMoney()) continue;
            float start = e.getValue().xStart();
            if (start < leftmostStart) {
                leftmostStart = start;
                leftmost = e.getKey();
            }
            if (start <= token.xStart() + TEXT_COLUMN_TOLERANCE && start > bestStart) {
                bestStart = start;
                best = e.getKey();
            }
        }
        return best != null ? best : leftmost;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    private static final class Layout {
        private final int linePosition;
        private final Map<RawColumn, Token> columns;

        private Layout(int linePosition, Map<RawColumn, Token> columns) {
            this.linePosition = linePosition;
            this.columns = columns;
        }
    }

    private static final class PendingRow {
        private final int sourceLine;
        private final Map<RawColumn, String> fields;

        private PendingRow(int sourceLine, Map<RawColumn, String> fields) {
            this.sourceLine = sourceLine;
            this.fields = new EnumMap<>(fields);
        }

        private void appendDescription(String more) {
            String current = fields.get(RawColumn.DESCRIPTION);
            fields.put(RawColumn.DESCRIPTION, notBlank(current) ? current + " " + more : more);
        }

        private RawRecord toRecord(int rowIndex, Layout layout) {
            List<String> cells = new ArrayList<>();
            layout.columns.entrySet().stream()
                    .sorted((a, b) -> Float.compare(a.getValue().xStart(), b.getValue().xStart()))
                    .forEach(e -> cells.add(fields.getOrDefault(e.getKey(), "")));
            return new RawRecord(rowIndex, sourceLine, fields, cells);
        }
    }
}

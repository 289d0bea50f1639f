package com.intellibank.analysis.services.extraction;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import com.intellibank.analysis.config.AnalysisProperties;
import com.intellibank.analysis.enums.StatementFormat;
import com.intellibank.analysis.exceptions.CorruptInputException;
import com.intellibank.analysis.exceptions.SchemaNotFoundException;

import lombok.extern.slf4j.Slf4j;

@Component
@Slf4j
public class CsvStatementExtractor implements StatementExtractor {

    private static final char[] CANDIDATE_DELIMITERS = {',', ';', '\t'};

    private final AnalysisProperties properties;

    public CsvStatementExtractor(AnalysisProperties properties) {
        this.properties = properties;
    }

    @Override
    public StatementFormat format() {
        return StatementFormat.CSV;
    }

    @Override
    public List<RawRecord> extract(byte[] fileBytes) {
        String text = decode(fileBytes);
        int window = properties.extraction().headerScanWindow();
        char delimiter = detectDelimiter(text, window);

        List<Integer> sourceLines = new ArrayList<>();
        List<List<String>> rows = parseRows(text, delimiter, sourceLines);

        HeaderLocator.HeaderMatch header = HeaderLocator.locate(rows, window)
                .orElseThrow(() -> new SchemaNotFoundException(
                        "CSV header with date, description and amount not found in the first " + window + " rows"));

        List<RawRecord> records = HeaderLocator.recordsAfter(rows, header, sourceLines::get);
        log.info("[CsvExtractor] headerRow={} columns={} records={} delimiter='{}'",
                header.rowPosition() + 1, header.columns().keySet(), records.size(), delimiter == '\t' ? "\\t" : delimiter);
        return records;
    }

    /**
     * Parses all records; {@code sourceLines} receives the 1-based line each record starts on, which
     * differs from its position once empty lines are skipped or a quoted field spans lines.
     */
    private static List<List<String>> parseRows(String text, char delimiter, List<Integer> sourceLines) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreSurroundingSpaces(true)
                .setIgnoreEmptyLines(true)
                .build();

        int[] lineStarts = lineStarts(text);
        List<List<String>> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(text, format)) {
            for (CSVRecord record : parser) {
                List<String> cells = new ArrayList<>(record.size());
                record.forEach(cells::add);
                rows.add(cells);
                sourceLines.add(lineAt(text, lineStarts, record.getCharacterPosition()));
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new CorruptInputException("Unparseable CSV content: " + e.getMessage(), e);
        }
        return rows;
    }

    /**
     * Line of the first character at or after {@code position} that is not a line break.
     */
    static int lineAt(String text, int[] lineStarts, long position) {
        int pos = (int) Math.min(position, text.length());
        while (pos < text.length() && (text.charAt(pos) == '\n' || text.charAt(pos) == '\r')) pos++;
        int found = Arrays.binarySearch(lineStarts, pos);
        return found >= 0 ? found + 1 : -found - 1;
    }

    /**
     * Offsets at which each line starts; a line ends with LF, CRLF or a lone CR.
     */
    static int[] lineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static String decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new CorruptInputException("CSV file is empty");
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            // Legacy bank exports are frequently Latin-1.
            text = new String(bytes, StandardCharsets.ISO_8859_1);
        }
        if (text.indexOf('\u0000') >= 0) {
            throw new CorruptInputException("CSV file contains binary content");
        }
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        if (text.isBlank()) {
            throw new CorruptInputException("CSV file is empty");
        }
        return text;
    }

    /**
     * Picks the delimiter occurring most often (outside quotes) across the header region.
     */
    static char detectDelimiter(String text, int window) {
        int[] counts = new int[CANDIDATE_DELIMITERS.length];
        boolean inQuotes = false;
        int lines = 0;
        for (int i = 0; i < text.length() && lines < window; i++) {
            char ch = text.charAt(i);
            if (ch == '"') {
                inQuotes = !inQuotes;
            } else if (ch == '\n' && !inQuotes) {
                lines++;
            } else if (!inQuotes) {
                for (int d = 0; d < CANDIDATE_DELIMITERS.length; d++) {
                    if (ch == CANDIDATE_DELIMITERS[d]) counts[d]++;
                }
            }
        }
        int best = 0;
        for (int d = 1; d < counts.length; d++) {
            if (counts[d] > counts[best]) best = d;
        }
        return CANDIDATE_DELIMITERS[best];
    }
}

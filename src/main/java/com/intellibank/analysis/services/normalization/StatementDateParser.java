package com.intellibank.analysis.services.normalization;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses statement dates against an ordered list of patterns; the first pattern that parses wins.
 * Month names are matched case-insensitively in English.
 */
public class StatementDateParser {

    private final List<DateTimeFormatter> formatters;

    public StatementDateParser(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("At least one date pattern is required");
        }
        List<DateTimeFormatter> list = new ArrayList<>(patterns.size());
        for (String p : patterns) {
            list.add(new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    // 'u' instead of 'y' so STRICT resolution works without an era field
                    .appendPattern(p.replace('y', 'u'))
                    .toFormatter(Locale.ENGLISH)
                    .withResolverStyle(ResolverStyle.STRICT));
        }
        this.formatters = List.copyOf(list);
    }

    public Optional<LocalDate> parse(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim().replaceAll("\\s+", " ");
        if (s.isEmpty()) return Optional.empty();

        Optional<LocalDate> parsed = tryAll(s);
        if (parsed.isEmpty()) {
            // ISO timestamps and spreadsheet exports like "2024-01-05 00:00:00"
            int cut = indexOfTimePart(s);
            if (cut > 0) parsed = tryAll(s.substring(0, cut).trim());
        }
        return parsed;
    }

    private Optional<LocalDate> tryAll(String s) {
        for (DateTimeFormatter f : formatters) {
            try {
                return Optional.of(LocalDate.parse(s, f));
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        return Optional.empty();
    }

    private static int indexOfTimePart(String s) {
        int t = s.indexOf('T');
        if (t > 0 && t + 1 < s.length() && Character.isDigit(s.charAt(t + 1))) return t;
        int colon = s.indexOf(':');
        if (colon > 0) {
            int space = s.lastIndexOf(' ', colon);
            if (space > 0) return space;
        }
        return -1;
    }
}

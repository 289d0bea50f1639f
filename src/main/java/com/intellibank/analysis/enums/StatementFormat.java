package com.intellibank.analysis.enums;

import java.util.Locale;

import com.intellibank.analysis.exceptions.UnsupportedFormatException;

public enum StatementFormat {
    PDF,
    CSV,
    SPREADSHEET;

    /**
     * Resolves a declared format string (case-insensitive). "xlsx" and "xls" are accepted as
     * spreadsheet aliases.
     */
    public static StatementFormat fromDeclared(String declared) {
        if (declared == null || declared.isBlank()) {
            throw new UnsupportedFormatException(String.valueOf(declared));
        }
        String d = declared.trim().toLowerCase(Locale.ROOT);
        if (d.startsWith(".")) d = d.substring(1);
        return switch (d) {
            case "pdf" -> PDF;
            case "csv" -> CSV;
            case "spreadsheet", "xlsx", "xls" -> SPREADSHEET;
            default -> throw new UnsupportedFormatException(declared);
        };
    }
}

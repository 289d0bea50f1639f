package com.intellibank.analysis.services.normalization;

import java.math.BigDecimal;
import java.util.Currency;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.intellibank.analysis.exceptions.UnparsableRecordException;

/**
 * Converts statement money text into signed minor units of a currency.
 *
 * <p>Accepted notations: currency symbols or ISO codes around the number, thousands separators,
 * decimal comma, {@code (1.00)} and trailing minus for negatives, {@code CR}/{@code DR} suffixes.
 * Values are never rounded: more fractional digits than the currency has is an error.
 */
public final class AmountParser {

    private static final Pattern ISO_CODE = Pattern.compile("(?i)(?:^|[^A-Z])([A-Z]{3})(?:$|[^A-Z])");
    private static final Pattern SUFFIX = Pattern.compile("(?i)\\s*(CR|DR)\\.?$");
    private static final Pattern DIGITS_AND_SEPARATORS = Pattern.compile("[0-9.,]+");

    private AmountParser() {}

    public static long parseMinorUnits(String raw, Currency currency) {
        if (raw == null || raw.isBlank()) {
            throw new UnparsableRecordException("Amount is empty");
        }
        String s = raw.trim();
        boolean negative = false;

        Matcher suffix = SUFFIX.matcher(s);
        if (suffix.find()) {
            negative = "DR".equalsIgnoreCase(suffix.group(1));
            s = s.substring(0, suffix.start()).trim();
        }

        s = s.replaceAll("\\p{Sc}", "")
                .replaceAll("(?i)\\b[A-Z]{3}\\b", "")
                .replaceAll("[\\s\\u00A0\\u2009\\u202F']", "");

        if (s.startsWith("(") && s.endsWith(")")) {
            negative = !negative;
            s = s.substring(1, s.length() - 1);
        }
        if (s.startsWith("-")) {
            negative = !negative;
            s = s.substring(1);
        } else if (s.startsWith("+")) {
            s = s.substring(1);
        }
        if (s.endsWith("-")) {
            negative = !negative;
            s = s.substring(0, s.length() - 1);
        }

        if (s.isEmpty() || !DIGITS_AND_SEPARATORS.matcher(s).matches()) {
            throw new UnparsableRecordException("Not a monetary amount: '" + raw + "'");
        }

        String plain = toPlainDecimal(s, raw);
        int allowed = fractionDigits(currency);
        int dot = plain.indexOf('.');
        int fraction = dot < 0 ? 0 : plain.length() - dot - 1;
        if (fraction > allowed) {
            throw new UnparsableRecordException("Amount '" + raw + "' has " + fraction
                    + " fractional digits, " + currency.getCurrencyCode() + " allows " + allowed);
        }

        try {
            long minor = new BigDecimal(plain).movePointRight(allowed).longValueExact();
            return negative ? -minor : minor;
        } catch (ArithmeticException | NumberFormatException e) {
            throw new UnparsableRecordException("Amount out of range: '" + raw + "'", e);
        }
    }

    /**
     * Returns an ISO 4217 code written next to the number ("EUR 12,00"), if any.
     */
    public static Optional<Currency> embeddedCurrency(String raw) {
        if (raw == null) return Optional.empty();
        Matcher m = ISO_CODE.matcher(raw.trim());
        while (m.find()) {
            String code = m.group(1).toUpperCase(Locale.ROOT);
            if ("CR".equals(code) || "DR".equals(code)) continue;
            try {
                return Optional.of(Currency.getInstance(code));
            } catch (IllegalArgumentException notACurrency) {
                // three letters that are not an ISO code, keep looking
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves which separator is the decimal one and drops the other.
     */
    private static String toPlainDecimal(String s, String raw) {
        int lastComma = s.lastIndexOf(',');
        int lastDot = s.lastIndexOf('.');
        String result;
        if (lastComma >= 0 && lastDot >= 0) {
            if (lastComma > lastDot) {
                result = s.replace(".", "").replace(',', '.');
            } else {
                result = s.replace(",", "");
            }
        } else if (lastComma >= 0) {
            int digitsAfter = s.length() - lastComma - 1;
            boolean single = s.indexOf(',') == lastComma;
            result = single && digitsAfter >= 1 && digitsAfter <= 2
                    ? s.replace(',', '.')
                    : s.replace(",", "");
        } else if (lastDot >= 0 && s.indexOf('.') != lastDot) {
            result = s.replace(".", "");
        } else {
            result = s;
        }
        if (result.indexOf('.') != result.lastIndexOf('.') || result.endsWith(".")) {
            throw new UnparsableRecordException("Ambiguous separators in amount '" + raw + "'");
        }
        return result;
    }

    private static int fractionDigits(Currency currency) {
        int digits = currency.getDefaultFractionDigits();
        return digits < 0 ? 2 : digits;
    }
}

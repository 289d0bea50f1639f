package com.intellibank.analysis.services.normalization;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic cleanup of bank descriptions into merchant names. Rules are applied in order and
 * are case-insensitive; the result is upper case.
 *
 * Example: "POS PURCHASE SQ *BLUE BOTTLE COFFEE 01/14 CARD 4821" => "BLUE BOTTLE COFFEE"
 */
public final class MerchantNameNormalizer {

    private static final List<Pattern> PROCESSOR_PREFIXES = List.of(
            Pattern.compile("^(?:RECURRING\\s+)?(?:DEBIT|CHECK|CHECKCARD)\\s+CARD\\s+PURCHASE\\s*[-:]?\\s*"),
            Pattern.compile("^(?:POS|POINT OF SALE)\\s+(?:PURCHASE|DEBIT|WITHDRAWAL|TRANSACTION)?\\s*[-:]?\\s*"),
            Pattern.compile("^(?:CARD|DEBIT|VISA|MASTERCARD|MC)\\s+PURCHASE\\s*[-:]?\\s*"),
            Pattern.compile("^PURCHASE\\s+(?:AUTHORIZED\\s+ON\\s+\\d{1,2}/\\d{1,2}\\s+)?"),
            Pattern.compile("^ACH\\s+(?:DEBIT|CREDIT|PMT|PAYMENT|TRANSFER)?\\s*[-:]?\\s*"),
            Pattern.compile("^(?:ONLINE|ELECTRONIC)\\s+(?:PAYMENT|TRANSFER)\\s+(?:TO|FROM)?\\s*"),
            Pattern.compile("^(?:SQ|TST|SP|PP|PAYPAL|GOOGLE|APL|AMZN MKTP|IN)\\s*\\*\\s*"),
            Pattern.compile("^POS\\s+"));

    private static final List<Pattern> NOISE = List.of(
            // card references: CARD 1234, XXXX1234, ****1234, X1234
            Pattern.compile("\\bCARD\\s*(?:NO\\.?|#)?\\s*[X*]*\\d{4}\\b"),
            Pattern.compile("[X*]{2,}\\d{4}\\b"),
            // references and ids
            Pattern.compile("\\b(?:REF|REFERENCE|TRACE|AUTH|CONF|ID|TXN|TRN)\\s*(?:NO\\.?|#|:)?\\s*[A-Z0-9-]*\\d[A-Z0-9-]*\\b"),
            Pattern.compile("#\\s*\\d+"),
            // embedded dates: 01/14, 01/14/24, 2024-01-14, 14JAN
            Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}\\b"),
            Pattern.compile("\\b\\d{1,2}/\\d{1,2}(?:/\\d{2,4})?\\b"),
            Pattern.compile("\\b\\d{1,2}(?:JAN|FEB|MAR|APR|MAY|JUN|JUL|AUG|SEP|OCT|NOV|DEC)(?:\\d{2,4})?\\b"),
            Pattern.compile("\\b\\d{4,}\\b"),
            Pattern.compile("\\b[A-Z]*\\d{6,}[A-Z0-9]*\\b"));

    private static final Pattern PUNCTUATION = Pattern.compile("[^A-Z0-9&' ]+");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private MerchantNameNormalizer() {}

    public static String normalize(String rawDescription) {
        if (rawDescription == null) return "";
        String collapsed = SPACES.matcher(rawDescription.replace('\u00A0', ' ')).replaceAll(" ").trim();
        if (collapsed.isEmpty()) return "";

        String s = collapsed.toUpperCase(Locale.ROOT);

        // prefixes can be stacked ("POS PURCHASE SQ *...")
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Pattern p : PROCESSOR_PREFIXES) {
                String next = p.matcher(s).replaceFirst("").trim();
                if (!next.equals(s) && !next.isEmpty()) {
                    s = next;
                    changed = true;
                }
            }
        }

        for (Pattern p : NOISE) {
            s = p.matcher(s).replaceAll(" ");
        }
        s = PUNCTUATION.matcher(s).replaceAll(" ");
        s = s.replaceAll("(?<![A-Z])'|'(?![A-Z])", " ");
        s = SPACES.matcher(s).replaceAll(" ").trim();

        if (s.isEmpty()) {
            return collapsed.toUpperCase(Locale.ROOT);
        }
        return s;
    }
}

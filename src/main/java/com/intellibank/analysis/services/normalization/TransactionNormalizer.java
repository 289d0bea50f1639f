package com.intellibank.analysis.services.normalization;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Currency;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.intellibank.analysis.config.AnalysisProperties;
import com.intellibank.analysis.entities.Transaction;
import com.intellibank.analysis.exceptions.UnparsableRecordException;
import com.intellibank.analysis.services.extraction.RawColumn;
import com.intellibank.analysis.services.extraction.RawRecord;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns raw records into canonical transactions: debits negative, credits positive, amounts in
 * minor units, merchant names cleaned up. Records that cannot be normalized are skipped and
 * counted, never dropped silently.
 */
@Service
@Slf4j
public class TransactionNormalizer {

    private static final Set<String> DEBIT_TYPES = Set.of("d", "dr", "debit", "withdrawal", "payment", "purchase", "out");
    private static final Set<String> CREDIT_TYPES = Set.of("c", "cr", "credit", "deposit", "refund", "in");

    private static final String UNKNOWN_MERCHANT = "UNKNOWN";

    private final StatementDateParser dateParser;
    private final Currency defaultCurrency;

    public TransactionNormalizer(AnalysisProperties properties) {
        AnalysisProperties.Normalization config = properties.normalization();
        this.dateParser = new StatementDateParser(config.dateFormats());
        this.defaultCurrency = Currency.getInstance(config.defaultCurrency().trim().toUpperCase(Locale.ROOT));
    }

    public NormalizationResult normalize(List<RawRecord> records) {
        return normalize(null, records);
    }

    public NormalizationResult normalize(String statementId, List<RawRecord> records) {
        if (records == null || records.isEmpty()) {
            return new NormalizationResult(List.of(), 0, List.of());
        }

        List<Transaction> transactions = new ArrayList<>(records.size());
        List<String> issues = new ArrayList<>();

        for (RawRecord record : records) {
            try {
                transactions.add(toTransaction(statementId, record));
            } catch (UnparsableRecordException e) {
                String issue = "line " + record.sourceLine() + ": " + e.getMessage();
                issues.add(issue);
                log.warn("[Normalizer] statementId={} skipped record {}", statementId, issue);
            }
        }

        transactions.sort(Comparator.comparing(Transaction::getPostedDate)
                .thenComparingInt(Transaction::getSourceIndex));

        log.debug("[Normalizer] statementId={} normalized={} skipped={}",
                statementId, transactions.size(), issues.size());
        return new NormalizationResult(transactions, issues.size(), issues);
    }

    Transaction toTransaction(String statementId, RawRecord record) {
        String rawDate = record.field(RawColumn.DATE);
        LocalDate postedDate = dateParser.parse(rawDate)
                .orElseThrow(() -> new UnparsableRecordException("unparsable date '" + nullToEmpty(rawDate) + "'"));

        Currency currency = resolveCurrency(record);
        long amount = resolveAmount(record, currency);
        Long balance = resolveBalance(statementId, record, currency);

        String description = nullToEmpty(record.field(RawColumn.DESCRIPTION)).trim();
        String merchant = MerchantNameNormalizer.normalize(description);
        if (merchant.isEmpty()) merchant = UNKNOWN_MERCHANT;

        return Transaction.builder()
                .id(UUID.randomUUID())
                .statementId(statementId)
                .postedDate(postedDate)
                .amount(amount)
                .balance(balance)
                .currency(currency.getCurrencyCode())
                .merchant(merchant)
                .rawDescription(description)
                .sourceIndex(record.rowIndex())
                .build();
    }

    private Currency resolveCurrency(RawRecord record) {
        if (record.hasValue(RawColumn.CURRENCY)) {
            String code = record.field(RawColumn.CURRENCY).trim().toUpperCase(Locale.ROOT);
            try {
                return Currency.getInstance(code);
            } catch (IllegalArgumentException e) {
                throw new UnparsableRecordException("unknown currency '" + code + "'", e);
            }
        }
        for (RawColumn money : List.of(RawColumn.AMOUNT, RawColumn.DEBIT, RawColumn.CREDIT)) {
            if (record.hasValue(money)) {
                var embedded = AmountParser.embeddedCurrency(record.field(money));
                if (embedded.isPresent()) return embedded.get();
            }
        }
        return defaultCurrency;
    }

    private long resolveAmount(RawRecord record, Currency currency) {
        boolean split = record.hasValue(RawColumn.DEBIT) || record.hasValue(RawColumn.CREDIT);
        if (split) {
            long debit = record.hasValue(RawColumn.DEBIT)
                    ? Math.abs(AmountParser.parseMinorUnits(record.field(RawColumn.DEBIT), currency)) : 0L;
            long credit = record.hasValue(RawColumn.CREDIT)
                    ? Math.abs(AmountParser.parseMinorUnits(record.field(RawColumn.CREDIT), currency)) : 0L;
            return credit - debit;
        }

        if (!record.hasValue(RawColumn.AMOUNT)) {
            throw new UnparsableRecordException("no amount");
        }
        long signed = AmountParser.parseMinorUnits(record.field(RawColumn.AMOUNT), currency);

        if (record.hasValue(RawColumn.TYPE)) {
            String type = record.field(RawColumn.TYPE).trim().toLowerCase(Locale.ROOT);
            if (DEBIT_TYPES.contains(type)) return -Math.abs(signed);
            if (CREDIT_TYPES.contains(type)) return Math.abs(signed);
        }
        return signed;
    }

    /**
     * An unparsable balance is dropped with a warning; the record itself is kept.
     */
    private static Long resolveBalance(String statementId, RawRecord record, Currency currency) {
        if (!record.hasValue(RawColumn.BALANCE)) return null;
        try {
            return AmountParser.parseMinorUnits(record.field(RawColumn.BALANCE), currency);
        } catch (UnparsableRecordException e) {
            log.warn("[Normalizer] statementId={} line {}: ignoring balance: {}",
                    statementId, record.sourceLine(), e.getMessage());
            return null;
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}

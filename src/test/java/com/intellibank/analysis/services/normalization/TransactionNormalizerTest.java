package com.intellibank.analysis.services.normalization;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.intellibank.analysis.config.AnalysisProperties;
import com.intellibank.analysis.entities.Transaction;
import com.intellibank.analysis.services.extraction.RawColumn;
import com.intellibank.analysis.services.extraction.RawRecord;

class TransactionNormalizerTest {

    private final TransactionNormalizer normalizer = new TransactionNormalizer(AnalysisProperties.defaults());

    @Test
    void normalize_sortsByPostedDate_thenDocumentOrder() {
        List<RawRecord> records = List.of(
                amountRecord(0, "01/09/2024", "NETFLIX.COM", "-15.49"),
                amountRecord(1, "01/05/2024", "STARBUCKS STORE #1234", "-4.50"),
                amountRecord(2, "01/09/2024", "SHELL OIL", "-38.20"));

        NormalizationResult result = normalizer.normalize("stmt-1", records);

        assertThat(result.unparsableCount()).isZero();
        assertThat(result.transactions()).extracting(Transaction::getSourceIndex).containsExactly(1, 0, 2);
        Transaction first = result.transactions().get(0);
        assertThat(first.getPostedDate()).isEqualTo(LocalDate.of(2024, 1, 5));
        assertThat(first.getAmount()).isEqualTo(-450L);
        assertThat(first.getCurrency()).isEqualTo("USD");
        assertThat(first.getMerchant()).isEqualTo("STARBUCKS STORE");
        assertThat(first.getRawDescription()).isEqualTo("STARBUCKS STORE #1234");
        assertThat(first.getStatementId()).isEqualTo("stmt-1");
        assertThat(first.getId()).isNotNull();
    }

    @Test
    void normalize_skipsAndCountsRecordsThatCannotBeParsed() {
        List<RawRecord> records = List.of(
                amountRecord(0, "01/05/2024", "STARBUCKS", "-4.50"),
                amountRecord(1, "not a date", "TARGET", "-20.00"),
                amountRecord(2, "01/07/2024", "TARGET", "twenty"));

        NormalizationResult result = normalizer.normalize(records);

        assertThat(result.transactions()).hasSize(1);
        assertThat(result.unparsableCount()).isEqualTo(2);
        assertThat(result.hasUnparsableRecords()).isTrue();
        assertThat(result.issues()).hasSize(2);
        assertThat(result.issues().get(0)).startsWith("line 3:").contains("not a date");
        assertThat(result.issueSummary()).startsWith("2 record(s) skipped");
    }

    @Test
    void normalize_signsDebitAndCreditColumns() {
        Map<RawColumn, String> rent = new EnumMap<>(RawColumn.class);
        rent.put(RawColumn.DATE, "2024-02-01");
        rent.put(RawColumn.DESCRIPTION, "Rent February");
        rent.put(RawColumn.DEBIT, "1200,00");
        rent.put(RawColumn.CREDIT, "");
        Map<RawColumn, String> salary = new EnumMap<>(RawColumn.class);
        salary.put(RawColumn.DATE, "2024-02-03");
        salary.put(RawColumn.DESCRIPTION, "Salary");
        salary.put(RawColumn.CREDIT, "3000,00");

        NormalizationResult result = normalizer.normalize(List.of(
                new RawRecord(0, 2, rent, List.of()),
                new RawRecord(1, 3, salary, List.of())));

        assertThat(result.transactions()).extracting(Transaction::getAmount).containsExactly(-120000L, 300000L);
    }

    @Test
    void normalize_keepsTheRunningBalance_andDropsOnlyAnUnreadableOne() {
        Map<RawColumn, String> withBalance = fields("2024-02-01", "Rent February", "-1,200.00");
        withBalance.put(RawColumn.BALANCE, "$3,800.00");
        Map<RawColumn, String> badBalance = fields("2024-02-02", "COFFEE", "-4.50");
        badBalance.put(RawColumn.BALANCE, "see note");

        NormalizationResult result = normalizer.normalize(List.of(
                new RawRecord(0, 2, withBalance, List.of()),
                new RawRecord(1, 3, badBalance, List.of()),
                amountRecord(2, "2024-02-03", "TARGET", "-20.00")));

        assertThat(result.unparsableCount()).isZero();
        assertThat(result.transactions()).extracting(Transaction::getBalance).containsExactly(380000L, null, null);
    }

    @Test
    void normalize_typeColumnForcesTheSign() {
        Map<RawColumn, String> purchase = fields("2024-03-01", "WHOLE FOODS MARKET", "82.14");
        purchase.put(RawColumn.TYPE, "DR");
        Map<RawColumn, String> refund = fields("2024-03-02", "WHOLE FOODS MARKET", "-10.00");
        refund.put(RawColumn.TYPE, "Refund");

        NormalizationResult result = normalizer.normalize(List.of(
                new RawRecord(0, 2, purchase, List.of()),
                new RawRecord(1, 3, refund, List.of())));

        assertThat(result.transactions()).extracting(Transaction::getAmount).containsExactly(-8214L, 1000L);
    }

    @Test
    void normalize_takesCurrencyFromColumnOrAmountText() {
        Map<RawColumn, String> euro = fields("2024-03-01", "CAFE DE FLORE", "EUR 12,00");
        Map<RawColumn, String> yen = fields("2024-03-02", "LAWSON", "1,500");
        yen.put(RawColumn.CURRENCY, "jpy");
        Map<RawColumn, String> bogus = fields("2024-03-03", "SOMEWHERE", "1.00");
        bogus.put(RawColumn.CURRENCY, "XYZ1");

        NormalizationResult result = normalizer.normalize(List.of(
                new RawRecord(0, 2, euro, List.of()),
                new RawRecord(1, 3, yen, List.of()),
                new RawRecord(2, 4, bogus, List.of())));

        assertThat(result.transactions()).extracting(Transaction::getCurrency).containsExactly("EUR", "JPY");
        assertThat(result.transactions()).extracting(Transaction::getAmount).containsExactly(1200L, 1500L);
        assertThat(result.unparsableCount()).isEqualTo(1);
    }

    @Test
    void normalize_usesUnknownMerchant_forEmptyDescriptions() {
        NormalizationResult result = normalizer.normalize(List.of(amountRecord(0, "2024-03-01", "", "-1.00")));

        assertThat(result.transactions().get(0).getMerchant()).isEqualTo("UNKNOWN");
    }

    @Test
    void normalize_returnsEmptyResult_forNoRecords() {
        NormalizationResult result = normalizer.normalize(List.of());

        assertThat(result.transactions()).isEmpty();
        assertThat(result.issueSummary()).isNull();
    }

    private static RawRecord amountRecord(int index, String date, String description, String amount) {
        return new RawRecord(index, index + 2, fields(date, description, amount), List.of(date, description, amount));
    }

    private static Map<RawColumn, String> fields(String date, String description, String amount) {
        Map<RawColumn, String> fields = new EnumMap<>(RawColumn.class);
        fields.put(RawColumn.DATE, date);
        fields.put(RawColumn.DESCRIPTION, description);
        fields.put(RawColumn.AMOUNT, amount);
        return fields;
    }
}

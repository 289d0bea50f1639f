package com.intellibank.analysis.entities;

import java.time.LocalDate;
import java.util.UUID;

import com.intellibank.analysis.classification.Category;
import com.intellibank.analysis.enums.AnomalyReason;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Canonical transaction. Amount is signed and expressed in minor units of {@link #currency}:
 * debits negative, credits positive.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    private UUID id;

    private String statementId;

    private LocalDate postedDate;

    private long amount;

    /** Running balance printed next to the transaction, minor units; null when the statement has none. */
    private Long balance;

    private String currency;

    private String merchant;

    private String rawDescription;

    /** Position of the source record in the statement. */
    private int sourceIndex;

    private Category category;

    private double categoryConfidence;

    private String categorySource;

    /** Null until the anomaly pass has run. */
    private Boolean anomaly;

    private AnomalyReason anomalyReason;

    public long absoluteAmount() {
        return Math.abs(amount);
    }

    public boolean isDebit() {
        return amount < 0;
    }

    public Transaction copy() {
        return toBuilder().build();
    }
}

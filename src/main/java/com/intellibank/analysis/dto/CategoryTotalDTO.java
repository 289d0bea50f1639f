package com.intellibank.analysis.dto;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CategoryTotalDTO {
    String category;
    /** Signed sum in minor units. */
    long total;
    /** Sum of debits in the category, as a positive number of minor units. */
    long spend;
    int count;
    BigDecimal percent;
    /** Change of {@link #total} against the previous statement; null without one. */
    Long deltaFromPrevious;
}

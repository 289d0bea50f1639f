package com.intellibank.analysis.services.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.intellibank.analysis.config.AnalysisProperties;
import com.intellibank.analysis.enums.StatementFormat;
import com.intellibank.analysis.exceptions.CorruptInputException;
import com.intellibank.analysis.exceptions.UnsupportedFormatException;

class FormatExtractionServiceTest {

    private final StatementExtractor csv = mock(StatementExtractor.class);

    @Test
    void extract_dispatchesToTheExtractorOfTheDeclaredFormat() {
        when(csv.format()).thenReturn(StatementFormat.CSV);
        RawRecord record = new RawRecord(0, 2, Map.of(RawColumn.AMOUNT, "1.00"), List.of("1.00"));
        when(csv.extract(any())).thenReturn(List.of(record));
        FormatExtractionService service = new FormatExtractionService(List.of(csv), AnalysisProperties.defaults());

        List<RawRecord> out = service.extract(new byte[] {'a'}, StatementFormat.CSV);

        assertThat(out).containsExactly(record);
    }

    @Test
    void extract_throwsUnsupportedFormat_whenNoExtractorIsRegistered() {
        when(csv.format()).thenReturn(StatementFormat.CSV);
        FormatExtractionService service = new FormatExtractionService(List.of(csv), AnalysisProperties.defaults());

        assertThatThrownBy(() -> service.extract(new byte[] {'a'}, StatementFormat.PDF))
                .isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    void extract_rejectsFilesAboveTheConfiguredLimit_withoutCallingTheExtractor() {
        when(csv.format()).thenReturn(StatementFormat.CSV);
        AnalysisProperties props = new AnalysisProperties(
                new AnalysisProperties.Extraction(30, 8), null, null, null, null, null);
        FormatExtractionService service = new FormatExtractionService(List.of(csv), props);

        assertThatThrownBy(() -> service.extract(new byte[9], StatementFormat.CSV))
                .isInstanceOf(CorruptInputException.class)
                .hasMessageContaining("maximum size");
        verify(csv, never()).extract(any());
    }

    @Test
    void constructor_failsWhenTwoExtractorsClaimTheSameFormat() {
        StatementExtractor other = mock(StatementExtractor.class);
        when(csv.format()).thenReturn(StatementFormat.CSV);
        when(other.format()).thenReturn(StatementFormat.CSV);

        assertThatThrownBy(() -> new FormatExtractionService(List.of(csv, other), AnalysisProperties.defaults()))
                .isInstanceOf(IllegalStateException.class);
    }
}

package com.intellibank.analysis.services.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import com.intellibank.analysis.config.AnalysisProperties;
import com.intellibank.analysis.exceptions.CorruptInputException;
import com.intellibank.analysis.exceptions.SchemaNotFoundException;

class SpreadsheetStatementExtractorTest {

    private final SpreadsheetStatementExtractor extractor = new SpreadsheetStatementExtractor(AnalysisProperties.defaults());

    @Test
    void extract_readsFirstSheet_withDateCellsAsIsoDates() throws IOException {
        byte[] xlsx;
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet("Transactions");
            CellStyle dateStyle = wb.createCellStyle();
            dateStyle.setDataFormat(wb.getCreationHelper().createDataFormat().getFormat("m/d/yy"));

            sheet.createRow(0).createCell(0).setCellValue("Checking account export");
            // row 1 left empty
            Row header = sheet.createRow(2);
            header.createCell(0).setCellValue("Date");
            header.createCell(1).setCellValue("Payee");
            header.createCell(2).setCellValue("Amount (USD)");

            addRow(sheet, 3, dateStyle, LocalDate.of(2024, 3, 1), "WHOLE FOODS MARKET", -82.14);
            addRow(sheet, 4, dateStyle, LocalDate.of(2024, 3, 2), "NETFLIX.COM", -15.49);
            addRow(sheet, 5, dateStyle, LocalDate.of(2024, 3, 4), "PAYROLL", 2100);
            addRow(sheet, 6, dateStyle, LocalDate.of(2024, 3, 9), "LYFT RIDE", -12.5);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            wb.write(out);
            xlsx = out.toByteArray();
        }

        List<RawRecord> records = extractor.extract(xlsx);

        assertThat(records).hasSize(4);
        assertThat(records).extracting(r -> r.field(RawColumn.DATE))
                .containsExactly("2024-03-01", "2024-03-02", "2024-03-04", "2024-03-09");
        assertThat(records).extracting(r -> r.field(RawColumn.DESCRIPTION))
                .containsExactly("WHOLE FOODS MARKET", "NETFLIX.COM", "PAYROLL", "LYFT RIDE");
        assertThat(records.get(0).field(RawColumn.AMOUNT)).isEqualTo("-82.14");
        assertThat(records.get(2).field(RawColumn.AMOUNT)).isEqualTo("2100");
        assertThat(records.get(3).sourceLine()).isEqualTo(7);
    }

    @Test
    void extract_throwsSchemaNotFound_forSheetWithoutHeader() throws IOException {
        byte[] xlsx;
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet();
            sheet.createRow(0).createCell(0).setCellValue("nothing to see");
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            wb.write(out);
            xlsx = out.toByteArray();
        }

        assertThatThrownBy(() -> extractor.extract(xlsx)).isInstanceOf(SchemaNotFoundException.class);
    }

    @Test
    void extract_throwsCorruptInput_forBytesThatAreNotAWorkbook() {
        byte[] bytes = "Date,Description,Amount\n".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> extractor.extract(bytes)).isInstanceOf(CorruptInputException.class);
    }

    private static void addRow(Sheet sheet, int index, CellStyle dateStyle, LocalDate date, String payee, double amount) {
        Row row = sheet.createRow(index);
        row.createCell(0).setCellValue(date);
        row.getCell(0).setCellStyle(dateStyle);
        row.createCell(1).setCellValue(payee);
        row.createCell(2).setCellValue(amount);
    }
}

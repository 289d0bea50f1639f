package com.intellibank.analysis.services.extraction;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import com.intellibank.analysis.config.AnalysisProperties;
import com.intellibank.analysis.enums.StatementFormat;
import com.intellibank.analysis.exceptions.CorruptInputException;
import com.intellibank.analysis.exceptions.SchemaNotFoundException;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads the first sheet of an .xlsx/.xls workbook. Date cells are rendered as ISO dates so the
 * normalizer does not depend on the workbook's display format.
 */
@Component
@Slf4j
public class SpreadsheetStatementExtractor implements StatementExtractor {

    private final AnalysisProperties properties;

    public SpreadsheetStatementExtractor(AnalysisProperties properties) {
        this.properties = properties;
    }

    @Override
    public StatementFormat format() {
        return StatementFormat.SPREADSHEET;
    }

    @Override
    public List<RawRecord> extract(byte[] fileBytes) {
        if (fileBytes == null || fileBytes.length == 0) {
            throw new CorruptInputException("Spreadsheet file is empty");
        }

        List<List<String>> rows;
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(fileBytes))) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new CorruptInputException("Workbook has no sheets");
            }
            rows = readRows(workbook, workbook.getSheetAt(0));
        } catch (CorruptInputException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new CorruptInputException("Unreadable spreadsheet workbook: " + e.getMessage(), e);
        }

        int window = properties.extraction().headerScanWindow();
        HeaderLocator.HeaderMatch header = HeaderLocator.locate(rows, window)
                .orElseThrow(() -> new SchemaNotFoundException(
                        "Spreadsheet header with date, description and amount not found in the first " + window + " rows"));

        List<RawRecord> records = HeaderLocator.recordsAfter(rows, header, r -> r + 1);
        log.info("[SpreadsheetExtractor] headerRow={} columns={} records={}",
                header.rowPosition() + 1, header.columns().keySet(), records.size());
        return records;
    }

    private static List<List<String>> readRows(Workbook workbook, Sheet sheet) {
        DataFormatter formatter = new DataFormatter();
        FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

        List<List<String>> rows = new ArrayList<>();
        int last = sheet.getLastRowNum();
        for (int r = 0; r <= last; r++) {
            Row row = sheet.getRow(r);
            List<String> cells = new ArrayList<>();
            if (row != null) {
                short lastCell = row.getLastCellNum();
                for (int c = 0; c < lastCell; c++) {
                    cells.add(cellText(row.getCell(c), formatter, evaluator));
                }
            }
            rows.add(cells);
        }
        return rows;
    }

    private static String cellText(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null) return "";
        if (cell.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            return cell.getLocalDateTimeCellValue().toLocalDate().toString();
        }
        return formatter.formatCellValue(cell, evaluator).trim();
    }
}

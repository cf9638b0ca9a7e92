package com.invoicebot.ai.service.extract;

import com.invoicebot.common.config.InvoiceBotProperties;
import com.invoicebot.common.model.SupportedMediaTypes;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Cell text of the active sheet of an XLSX/XLS workbook, one line per
 * non-empty row, cells separated by spaces. Formula cells contribute their
 * cached value.
 */
@Slf4j
@Component
public class SpreadsheetTextExtractor implements DocumentTextExtractor {

    private final int maxRows;
    private final int maxChars;

    public SpreadsheetTextExtractor(InvoiceBotProperties properties) {
        this.maxRows = properties.getClassifier().getMaxSpreadsheetRows();
        this.maxChars = properties.getClassifier().getMaxTextChars();
    }

    @Override
    public boolean supports(String mediaType, String filename) {
        return SupportedMediaTypes.isSpreadsheet(mediaType, filename);
    }

    @Override
    public String extract(byte[] content) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                return "";
            }
            Sheet sheet = workbook.getSheetAt(workbook.getActiveSheetIndex());
            DataFormatter formatter = new DataFormatter();
            List<String> lines = new ArrayList<>();

            for (int r = sheet.getFirstRowNum(); r >= 0 && r <= sheet.getLastRowNum() && r < maxRows; r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                List<String> cells = new ArrayList<>();
                for (Cell cell : row) {
                    String value = cellText(cell, formatter).strip();
                    if (!value.isEmpty()) {
                        cells.add(value);
                    }
                }
                if (!cells.isEmpty()) {
                    lines.add(String.join(" ", cells));
                }
            }

            String text = String.join("\n", lines);
            String truncated = text.length() > maxChars ? text.substring(0, maxChars) : text;
            log.debug("Spreadsheet extraction: rows_read={} chars_sent={}", lines.size(), truncated.length());
            return truncated;
        }
    }

    private static String cellText(Cell cell, DataFormatter formatter) {
        if (cell.getCellType() != CellType.FORMULA) {
            return formatter.formatCellValue(cell);
        }
        return switch (cell.getCachedFormulaResultType()) {
            case STRING -> cell.getStringCellValue();
            case NUMERIC -> formatter.formatRawCellContents(cell.getNumericCellValue(),
                    cell.getCellStyle().getDataFormat(), cell.getCellStyle().getDataFormatString());
            case BOOLEAN -> String.valueOf(cell.getBooleanCellValue());
            default -> "";
        };
    }
}

package com.invoicebot.mail.service;

import com.invoicebot.common.entity.Invoice;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.common.usermodel.HyperlinkType;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.Hyperlink;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders the monthly invoice summary: one row per invoice, a blank row, a
 * per-supplier block and a grand total.
 */
@Slf4j
public final class MonthlySummaryWorkbook {

    static final String[] COLUMNS = {
            "Date", "Supplier", "Sender email", "Filename", "HT", "TVA", "TTC", "Currency", "Link", "Period"
    };
    static final String[] SUMMARY_COLUMNS = {"Supplier", "Invoices", "Total HT", "Total TVA", "Total TTC"};

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final int[] COLUMN_WIDTHS = {14, 30, 36, 50, 14, 14, 14, 10, 12, 10};

    private MonthlySummaryWorkbook() {
    }

    public static byte[] build(List<Invoice> invoices, YearMonth period, String homeCurrency) throws IOException {
        String periodLabel = String.format("%02d/%d", period.getMonthValue(), period.getYear());

        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet(period.toString());
            CreationHelper helper = workbook.getCreationHelper();

            CellStyle header = headerStyle(workbook);
            CellStyle amount = workbook.createCellStyle();
            amount.setDataFormat(helper.createDataFormat().getFormat("#,##0.00"));
            amount.setAlignment(HorizontalAlignment.RIGHT);
            amount.setBorderBottom(BorderStyle.THIN);
            CellStyle text = workbook.createCellStyle();
            text.setBorderBottom(BorderStyle.THIN);
            CellStyle link = linkStyle(workbook);
            CellStyle total = headerStyle(workbook);
            total.setDataFormat(helper.createDataFormat().getFormat("#,##0.00"));

            Row headerRow = sheet.createRow(0);
            for (int i = 0; i < COLUMNS.length; i++) {
                cell(headerRow, i, COLUMNS[i], header);
            }

            Map<String, SupplierTotals> bySupplier = new TreeMap<>();
            int rowIndex = 1;
            for (Invoice invoice : invoices) {
                Row row = sheet.createRow(rowIndex++);
                LocalDate date = invoice.getInvoiceDate() != null ? invoice.getInvoiceDate() : invoice.getReceivedDate();
                String supplier = supplierName(invoice);

                cell(row, 0, date == null ? "" : DATE.format(date), text);
                cell(row, 1, supplier, text);
                cell(row, 2, invoice.getSender(), text);
                cell(row, 3, invoice.getFilename(), text);
                amountCell(row, 4, invoice.getAmountPretax(), amount);
                amountCell(row, 5, invoice.getAmountTax(), amount);
                amountCell(row, 6, invoice.getAmountTotal(), amount);
                cell(row, 7, invoice.getCurrency() != null ? invoice.getCurrency() : homeCurrency, text);

                Cell linkCell = row.createCell(8);
                if (invoice.getDriveWebLink() != null && !invoice.getDriveWebLink().isBlank()) {
                    Hyperlink hyperlink = helper.createHyperlink(HyperlinkType.URL);
                    hyperlink.setAddress(invoice.getDriveWebLink());
                    linkCell.setCellValue("Open");
                    linkCell.setHyperlink(hyperlink);
                    linkCell.setCellStyle(link);
                } else {
                    linkCell.setCellValue("-");
                    linkCell.setCellStyle(text);
                }
                cell(row, 9, periodLabel, text);

                bySupplier.computeIfAbsent(supplier, k -> new SupplierTotals()).add(invoice);
            }

            if (!invoices.isEmpty()) {
                sheet.setAutoFilter(new CellRangeAddress(0, invoices.size(), 0, COLUMNS.length - 1));
            }

            // per-supplier block after one blank row
            rowIndex++;
            Row summaryHeader = sheet.createRow(rowIndex++);
            for (int i = 0; i < SUMMARY_COLUMNS.length; i++) {
                cell(summaryHeader, i, SUMMARY_COLUMNS[i], header);
            }

            SupplierTotals grand = new SupplierTotals();
            for (Map.Entry<String, SupplierTotals> entry : bySupplier.entrySet()) {
                SupplierTotals totals = entry.getValue();
                Row row = sheet.createRow(rowIndex++);
                cell(row, 0, entry.getKey(), text);
                row.createCell(1).setCellValue(totals.count());
                totalCells(row, totals, amount);
                grand.merge(totals);
            }

            Row totalRow = sheet.createRow(rowIndex);
            cell(totalRow, 0, "TOTAL - " + invoices.size() + " invoice(s)", total);
            Cell countCell = totalRow.createCell(1);
            countCell.setCellValue(grand.count());
            countCell.setCellStyle(total);
            totalCells(totalRow, grand, total);

            for (int i = 0; i < COLUMN_WIDTHS.length; i++) {
                sheet.setColumnWidth(i, COLUMN_WIDTHS[i] * 256);
            }
            sheet.createFreezePane(0, 1);

            workbook.write(out);
            log.info("Built Excel summary for {}: {} invoice(s), {} supplier(s), {} bytes",
                    period, invoices.size(), bySupplier.size(), out.size());
            return out.toByteArray();
        }
    }

    /** Extracted supplier, else the capitalized sender label. */
    static String supplierName(Invoice invoice) {
        if (invoice.getSupplier() != null && !invoice.getSupplier().isBlank()) {
            return invoice.getSupplier();
        }
        String label = StorageNaming.senderLabel(invoice.getSender());
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }

    private static void cell(Row row, int column, String value, CellStyle style) {
        Cell cell = row.createCell(column);
        cell.setCellValue(value == null ? "" : value);
        cell.setCellStyle(style);
    }

    private static void amountCell(Row row, int column, Double value, CellStyle style) {
        Cell cell = row.createCell(column);
        if (value != null) {
            cell.setCellValue(value);
        }
        cell.setCellStyle(style);
    }

    // blank amounts when no invoice of the group carried any
    private static void totalCells(Row row, SupplierTotals totals, CellStyle style) {
        for (int i = 0; i < 3; i++) {
            Cell cell = row.createCell(2 + i);
            if (totals.hasAmounts()) {
                cell.setCellValue(i == 0 ? totals.pretax() : i == 1 ? totals.tax() : totals.total());
            }
            cell.setCellStyle(style);
        }
    }

    private static CellStyle headerStyle(Workbook workbook) {
        Font font = workbook.createFont();
        font.setBold(true);
        font.setColor(IndexedColors.WHITE.getIndex());
        CellStyle style = workbook.createCellStyle();
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.DARK_BLUE.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        return style;
    }

    private static CellStyle linkStyle(Workbook workbook) {
        Font font = workbook.createFont();
        font.setUnderline(Font.U_SINGLE);
        font.setColor(IndexedColors.BLUE.getIndex());
        CellStyle style = workbook.createCellStyle();
        style.setFont(font);
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setBorderBottom(BorderStyle.THIN);
        return style;
    }
}

package com.invoicebot.mail.service;

import com.invoicebot.common.entity.Invoice;
import com.invoicebot.common.model.SupportedMediaTypes;
import org.jsoup.nodes.Entities;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Graph message JSON for the monthly report draft addressed to the
 * accountant: one table row per invoice, the per-supplier totals, the shared
 * month folder link and the workbook as attachment.
 */
public final class MonthlyReportDraft {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final String TH = "<th style=\"padding:8px 12px;text-align:%s;\">%s</th>";
    private static final String TD = "<td style=\"padding:6px 12px;border-bottom:1px solid #eee;text-align:%s;\">%s</td>";

    private MonthlyReportDraft() {
    }

    static String subject(YearMonth period) {
        return "Invoices - " + period.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH) + " " + period.getYear();
    }

    /**
     * @param folderLink   shared month folder, empty when it could not be created
     * @param workbook     XLSX summary, null when it could not be built
     */
    public static Map<String, Object> message(String accountantEmail, List<Invoice> invoices, YearMonth period,
            String homeCurrency, String folderLink, byte[] workbook, String workbookName) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("subject", subject(period));
        message.put("body", Map.of(
                "contentType", "HTML",
                "content", htmlBody(invoices, period, homeCurrency, folderLink, workbook != null)));
        message.put("toRecipients", List.of(Map.of("emailAddress", Map.of("address", accountantEmail))));
        if (workbook != null) {
            message.put("attachments", List.of(Map.of(
                    "@odata.type", "#microsoft.graph.fileAttachment",
                    "name", workbookName,
                    "contentType", SupportedMediaTypes.XLSX,
                    "contentBytes", Base64.getEncoder().encodeToString(workbook))));
        }
        return message;
    }

    static String htmlBody(List<Invoice> invoices, YearMonth period, String homeCurrency,
            String folderLink, boolean workbookAttached) {
        String month = period.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH) + " " + period.getYear();
        StringBuilder html = new StringBuilder();
        html.append("<html><head><meta charset=\"UTF-8\"></head>")
                .append("<body style=\"font-family:Arial,sans-serif;color:#333;max-width:860px;margin:auto;\">")
                .append("<h2 style=\"color:#2c5f8a;\">").append(escape(subject(period))).append("</h2>")
                .append("<p>Hello,</p>")
                .append("<p>Here is the summary of the invoices received for ").append(escape(month))
                .append(" (").append(invoices.size()).append(" invoice(s)).</p>");

        html.append("<table style=\"border-collapse:collapse;width:100%;margin:20px 0;\"><thead>")
                .append("<tr style=\"background:#2c5f8a;color:white;\">")
                .append(th("left", "Date")).append(th("left", "Supplier")).append(th("left", "File"))
                .append(th("right", "HT")).append(th("right", "TTC")).append(th("center", "OneDrive"))
                .append("</tr></thead><tbody>");

        Map<String, SupplierTotals> bySupplier = new TreeMap<>();
        for (Invoice invoice : invoices) {
            String supplier = MonthlySummaryWorkbook.supplierName(invoice);
            String currency = currency(invoice, homeCurrency);
            LocalDate date = invoice.getInvoiceDate() != null ? invoice.getInvoiceDate() : invoice.getReceivedDate();
            String link = invoice.getDriveWebLink() == null || invoice.getDriveWebLink().isBlank()
                    ? "-"
                    : "<a href=\"" + escape(invoice.getDriveWebLink()) + "\">Open</a>";

            html.append("<tr>")
                    .append(td("left", date == null ? "-" : DATE.format(date)))
                    .append(td("left", escape(supplier)))
                    .append(td("left", escape(invoice.getFilename())))
                    .append(td("right", amount(invoice.getAmountPretax(), currency)))
                    .append(td("right", amount(invoice.getAmountTotal(), currency)))
                    .append(td("center", link))
                    .append("</tr>");
            bySupplier.computeIfAbsent(supplier, k -> new SupplierTotals()).add(invoice);
        }
        html.append("</tbody></table>");

        html.append(supplierSummary(bySupplier, homeCurrency));

        if (workbookAttached) {
            html.append("<p>The Excel summary is attached to this email.</p>");
        }
        if (folderLink != null && !folderLink.isBlank()) {
            html.append("<p style=\"margin-top:30px;\">OneDrive folder for the month: <a href=\"")
                    .append(escape(folderLink)).append("\">").append(escape(folderLink)).append("</a></p>");
        }
        html.append("<hr style=\"border:none;border-top:1px solid #eee;margin-top:40px;\">")
                .append("<p style=\"font-size:12px;color:#999;\">Generated by the invoice bot. Review before sending.</p>")
                .append("</body></html>");
        return html.toString();
    }

    private static String supplierSummary(Map<String, SupplierTotals> bySupplier, String currency) {
        StringBuilder html = new StringBuilder();
        html.append("<h3 style=\"color:#2c5f8a;margin-top:30px;\">Summary by supplier</h3>")
                .append("<table style=\"border-collapse:collapse;width:100%;margin:10px 0;\"><thead>")
                .append("<tr style=\"background:#2c5f8a;color:white;\">")
                .append(th("left", "Supplier")).append(th("center", "Invoices"))
                .append(th("right", "Total HT")).append(th("right", "Total TVA")).append(th("right", "Total TTC"))
                .append("</tr></thead><tbody>");

        SupplierTotals grand = new SupplierTotals();
        for (Map.Entry<String, SupplierTotals> entry : bySupplier.entrySet()) {
            html.append("<tr>").append(td("left", escape(entry.getKey())));
            totalCells(html, entry.getValue(), currency);
            html.append("</tr>");
            grand.merge(entry.getValue());
        }
        html.append("<tr style=\"background:#2c5f8a;color:white;font-weight:bold;\">")
                .append(td("left", "TOTAL"));
        totalCells(html, grand, currency);
        html.append("</tr></tbody></table>");
        return html.toString();
    }

    private static void totalCells(StringBuilder html, SupplierTotals totals, String currency) {
        html.append(td("center", String.valueOf(totals.count())));
        html.append(td("right", totals.hasAmounts() ? amount(totals.pretax(), currency) : "-"));
        html.append(td("right", totals.hasAmounts() ? amount(totals.tax(), currency) : "-"));
        html.append(td("right", totals.hasAmounts() ? amount(totals.total(), currency) : "-"));
    }

    private static String currency(Invoice invoice, String homeCurrency) {
        return invoice.getCurrency() != null && !invoice.getCurrency().isBlank() ? invoice.getCurrency() : homeCurrency;
    }

    static String amount(Double value, String currency) {
        if (value == null) {
            return "-";
        }
        return String.format(Locale.ROOT, "%,.2f %s", value, escape(currency));
    }

    private static String th(String align, String label) {
        return String.format(TH, align, label);
    }

    private static String td(String align, String content) {
        return String.format(TD, align, content);
    }

    private static String escape(String value) {
        return value == null ? "" : Entities.escape(value);
    }
}

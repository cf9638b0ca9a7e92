package com.invoicebot.common.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Media types the bot knows how to classify, plus the extension mappings used
 * for archive members and downloaded files.
 */
public final class SupportedMediaTypes {

    public static final String PDF = "application/pdf";
    public static final String PDF_ALIAS = "application/x-pdf";
    public static final String JPEG = "image/jpeg";
    public static final String PNG = "image/png";
    public static final String TIFF = "image/tiff";
    public static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    public static final String XLS = "application/vnd.ms-excel";
    public static final String ZIP = "application/zip";
    public static final String ZIP_ALIAS = "application/x-zip-compressed";

    private static final Set<String> SUPPORTED = Set.of(
            PDF, PDF_ALIAS, JPEG, PNG, TIFF, XLSX, XLS, ZIP, ZIP_ALIAS);

    private static final Map<String, String> BY_EXTENSION = Map.of(
            "pdf", PDF,
            "jpg", JPEG,
            "jpeg", JPEG,
            "png", PNG,
            "tiff", TIFF,
            "xlsx", XLSX,
            "xls", XLS);

    private static final Map<String, String> EXTENSION_BY_TYPE = Map.of(
            PDF, ".pdf",
            PDF_ALIAS, ".pdf",
            JPEG, ".jpg",
            PNG, ".png",
            TIFF, ".tiff",
            XLSX, ".xlsx",
            XLS, ".xls",
            ZIP, ".zip",
            ZIP_ALIAS, ".zip");

    private SupportedMediaTypes() {
    }

    /** Strips charset/boundary parameters and lowercases. */
    public static String normalize(String contentType) {
        if (contentType == null) {
            return "application/octet-stream";
        }
        int semicolon = contentType.indexOf(';');
        String base = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        base = base.trim().toLowerCase(Locale.ROOT);
        return base.isEmpty() ? "application/octet-stream" : base;
    }

    public static boolean isSupported(String contentType) {
        return SUPPORTED.contains(normalize(contentType));
    }

    public static boolean isContainer(String contentType, String name) {
        String ct = normalize(contentType);
        return ZIP.equals(ct) || ZIP_ALIAS.equals(ct)
                || (name != null && name.toLowerCase(Locale.ROOT).endsWith(".zip"));
    }

    public static boolean isPdf(String contentType, String name) {
        String ct = normalize(contentType);
        return PDF.equals(ct) || PDF_ALIAS.equals(ct) || hasExtension(name, "pdf");
    }

    public static boolean isSpreadsheet(String contentType, String name) {
        String ct = normalize(contentType);
        return XLSX.equals(ct) || XLS.equals(ct) || hasExtension(name, "xlsx") || hasExtension(name, "xls");
    }

    /** Canonical image media type, or empty when the document is not an image. */
    public static Optional<String> imageType(String contentType, String name) {
        String ct = normalize(contentType);
        if (JPEG.equals(ct) || "image/jpg".equals(ct) || hasExtension(name, "jpg") || hasExtension(name, "jpeg")) {
            return Optional.of(JPEG);
        }
        if (PNG.equals(ct) || hasExtension(name, "png")) {
            return Optional.of(PNG);
        }
        if (TIFF.equals(ct) || hasExtension(name, "tiff")) {
            return Optional.of(TIFF);
        }
        return Optional.empty();
    }

    /** Media type for a non-container document extension (archive members). */
    public static Optional<String> forDocumentExtension(String filename) {
        String ext = extensionOf(filename);
        return Optional.ofNullable(BY_EXTENSION.get(ext));
    }

    public static String extensionFor(String contentType) {
        return EXTENSION_BY_TYPE.getOrDefault(normalize(contentType), "");
    }

    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static boolean hasExtension(String name, String ext) {
        return ext.equals(extensionOf(name));
    }
}

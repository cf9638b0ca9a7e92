package com.invoicebot.mail.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import static org.junit.jupiter.api.Assertions.*;

class StorageNamingTest {

    private static final OffsetDateTime RECEIVED = OffsetDateTime.parse("2025-06-20T14:30:00Z");

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Filename
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should fall back to received date and sender domain")
    void buildFilename_shouldUseReceivedDateAndSenderDomain() {
        String name = StorageNaming.buildFilename(null, RECEIVED, null, "noreply@shop.com", "bill.pdf");

        assertTrue(name.startsWith("2025-06-20_shop_"));
        assertEquals("2025-06-20_shop_bill.pdf", name);
    }

    @Test
    @DisplayName("Should prefer invoice date and supplier slug")
    void buildFilename_shouldPreferExtractedFields() {
        String name = StorageNaming.buildFilename(LocalDate.of(2024, 12, 3), RECEIVED,
                "EDF Électricité de France", "noreply@shop.com", "bill.pdf");

        assertEquals("2024-12-03_edf-electricite-de-france_bill.pdf", name);
    }

    @Test
    @DisplayName("Should use the received date in UTC")
    void buildFilename_shouldConvertReceivedDateToUtc() {
        OffsetDateTime lateEvening = OffsetDateTime.parse("2025-06-20T23:30:00-02:00");

        String name = StorageNaming.buildFilename(null, lateEvening, null, "a@shop.com", "x.pdf");

        assertEquals("2025-06-21_shop_x.pdf", name);
    }

    @Test
    @DisplayName("Should use a sentinel date when nothing is known")
    void buildFilename_shouldUseSentinelDate() {
        assertEquals("0000-00-00_shop_x.pdf", StorageNaming.buildFilename(null, null, null, "a@shop.com", "x.pdf"));
    }

    @Test
    @DisplayName("Should replace characters OneDrive rejects")
    void sanitize_shouldReplaceForbiddenCharacters() {
        assertEquals("a_b_c_d_e_.pdf", StorageNaming.sanitize("a<b>c:d|e?.pdf"));
        assertEquals("dir_file.pdf", StorageNaming.sanitize("dir/file.pdf"));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Labels
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should slugify supplier names")
    void supplierLabel_shouldSlugify() {
        assertEquals("free-sas", StorageNaming.supplierLabel("Free SAS"));
        assertEquals("orange-s-a", StorageNaming.supplierLabel("Orange S.A."));
        assertEquals(40, StorageNaming.supplierLabel("A very long supplier name that keeps going and going").length());
    }

    @Test
    @DisplayName("Should strip compound TLDs from sender domains")
    void senderLabel_shouldHandleCompoundTlds() {
        assertEquals("acme", StorageNaming.senderLabel("billing@mail.acme.co.uk"));
        assertEquals("shop", StorageNaming.senderLabel("noreply@shop.com"));
        assertEquals("shop", StorageNaming.senderLabel("noreply@mail.shop.com"));
        assertEquals("localhost", StorageNaming.senderLabel("root@localhost"));
    }

    @Test
    @DisplayName("Should fall back to the sender when the supplier yields no slug")
    void companyLabel_shouldFallBackToSender() {
        assertEquals("shop", StorageNaming.companyLabel("日本", "noreply@shop.com"));
        assertEquals("shop", StorageNaming.companyLabel("  ", "noreply@shop.com"));
        assertEquals("acme", StorageNaming.companyLabel("ACME", "noreply@shop.com"));
    }
}

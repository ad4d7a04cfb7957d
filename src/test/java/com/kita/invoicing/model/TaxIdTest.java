package com.kita.invoicing.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TaxId and FiscalId
 */
class TaxIdTest {

    @Nested
    @DisplayName("TaxId")
    class TaxIdTests {

        @Test
        @DisplayName("should normalize case and whitespace")
        void shouldNormalize() {
            TaxId taxId = TaxId.of("  eku9003173c9 ");

            assertEquals("EKU9003173C9", taxId.getValue());
            assertEquals(TaxId.of("EKU9003173C9"), taxId);
        }

        @Test
        @DisplayName("should return null when normalizing blank input")
        void shouldNormalizeBlankToNull() {
            assertNull(TaxId.normalize(null));
            assertNull(TaxId.normalize("   "));
        }

        @Test
        @DisplayName("should distinguish companies from individuals")
        void shouldDetectCompany() {
            assertTrue(TaxId.of("EKU9003173C9").isCompany());
            assertFalse(TaxId.of("VADA800927DJ3").isCompany());
        }

        @Test
        @DisplayName("should derive the invoice series from the first three characters")
        void shouldDeriveSerie() {
            assertEquals("EKU", TaxId.of("EKU9003173C9").serie());
            assertEquals("VAD", TaxId.of("VADA800927DJ3").serie());
        }

        @Test
        @DisplayName("should accept ñ and ampersand in the name part")
        void shouldAcceptSpecialLetters() {
            assertTrue(TaxId.isValid("ÑA&010101AB1"));
        }

        @Test
        @DisplayName("should reject malformed RFCs")
        void shouldRejectMalformed() {
            assertFalse(TaxId.isValid("EKU900317"));
            assertFalse(TaxId.isValid("12345678901A"));
            assertFalse(TaxId.isValid(""));
            assertThrows(IllegalArgumentException.class, () -> TaxId.of("not-an-rfc"));
            assertThrows(IllegalArgumentException.class, () -> TaxId.of(null));
        }

        @Test
        @DisplayName("should expose generic RFCs")
        void shouldExposeGenericRfcs() {
            assertEquals("XAXX010101000", TaxId.GENERIC_DOMESTIC.getValue());
            assertEquals("XEXX010101000", TaxId.GENERIC_FOREIGN.toString());
        }
    }

    @Nested
    @DisplayName("FiscalId")
    class FiscalIdTests {

        @Test
        @DisplayName("should canonicalize to upper case")
        void shouldUpperCase() {
            FiscalId fiscalId = FiscalId.of(" 7f3c2b8e-1a2d-4c5e-9f60-0a1b2c3d4e5f ");

            assertEquals("7F3C2B8E-1A2D-4C5E-9F60-0A1B2C3D4E5F", fiscalId.getValue());
            assertEquals(FiscalId.of("7F3C2B8E-1A2D-4C5E-9F60-0A1B2C3D4E5F"), fiscalId);
        }

        @Test
        @DisplayName("should reject blank or malformed values")
        void shouldRejectInvalid() {
            assertThrows(IllegalArgumentException.class, () -> FiscalId.of(null));
            assertThrows(IllegalArgumentException.class, () -> FiscalId.of(" "));
            assertThrows(IllegalArgumentException.class, () -> FiscalId.of("not-a-uuid"));
        }
    }

    @Nested
    @DisplayName("InvoiceRecord")
    class InvoiceRecordTests {

        @Test
        @DisplayName("should default to draft in MXN")
        void shouldApplyDefaults() {
            InvoiceRecord record = InvoiceRecord.builder()
                .id("inv-1")
                .tenantId("tenant-1")
                .serie("EKU")
                .folio("000042")
                .build();

            assertEquals(InvoiceStatus.DRAFT, record.getStatus());
            assertEquals("MXN", record.getCurrency());
            assertEquals(42, record.folioNumber());
            assertEquals("EKU-000042", record.serieFolio());
            assertNotNull(record.getCreatedAt());
        }

        @Test
        @DisplayName("should record cancellation without touching the original")
        void shouldCancel() {
            InvoiceRecord stamped = InvoiceRecord.builder()
                .id("inv-1")
                .tenantId("tenant-1")
                .serie("EKU")
                .folio("000001")
                .status(InvoiceStatus.STAMPED)
                .build();
            Instant at = Instant.parse("2026-03-20T10:00:00Z");

            InvoiceRecord cancelled = stamped.cancel(at, "02");

            assertEquals(InvoiceStatus.CANCELLED, cancelled.getStatus());
            assertEquals(at, cancelled.getCancelledAt());
            assertEquals("02", cancelled.getCancellationReason());
            assertEquals(InvoiceStatus.STAMPED, stamped.getStatus());
        }

        @Test
        @DisplayName("should copy document bytes defensively")
        void shouldCopyBytes() {
            byte[] xml = {1, 2, 3};
            InvoiceRecord record = InvoiceRecord.builder()
                .id("inv-1").tenantId("t").serie("EKU").folio("000001").xml(xml).build();

            xml[0] = 9;
            record.getXml()[1] = 9;

            assertArrayEquals(new byte[] {1, 2, 3}, record.getXml());
        }
    }
}

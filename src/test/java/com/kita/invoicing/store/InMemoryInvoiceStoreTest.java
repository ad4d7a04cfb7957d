package com.kita.invoicing.store;

import com.kita.invoicing.exception.ConflictException;
import com.kita.invoicing.model.FiscalId;
import com.kita.invoicing.model.InvoiceRecord;
import com.kita.invoicing.model.InvoiceStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InMemoryInvoiceStore
 */
class InMemoryInvoiceStoreTest {

    private InMemoryInvoiceStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryInvoiceStore();
    }

    private InvoiceRecord record(String id, String tenantId, String serie, String folio) {
        return InvoiceRecord.builder()
            .id(id)
            .tenantId(tenantId)
            .serie(serie)
            .folio(folio)
            .build();
    }

    @Nested
    @DisplayName("insert")
    class Insert {

        @Test
        @DisplayName("should reject a repeated serie and folio within a tenant")
        void shouldRejectDuplicateFolio() {
            store.insert(record("i1", "tenant-a", "EKU", "000001"));

            ConflictException error = assertThrows(ConflictException.class,
                () -> store.insert(record("i2", "tenant-a", "EKU", "000001")));

            assertEquals(ConflictException.ConflictCode.DUPLICATE_FOLIO, error.getConflictCode());
            assertTrue(error.getMessage().contains("EKU-000001"));
        }

        @Test
        @DisplayName("should allow the same folio for another tenant or serie")
        void shouldAllowSameFolioElsewhere() {
            store.insert(record("i1", "tenant-a", "EKU", "000001"));

            assertDoesNotThrow(() -> store.insert(record("i2", "tenant-b", "EKU", "000001")));
            assertDoesNotThrow(() -> store.insert(record("i3", "tenant-a", "VAD", "000001")));
        }

        @Test
        @DisplayName("should reject a duplicate id")
        void shouldRejectDuplicateId() {
            store.insert(record("i1", "tenant-a", "EKU", "000001"));

            assertThrows(IllegalArgumentException.class, () -> store.insert(record("i1", "tenant-a", "EKU", "000002")));
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("should return zero when the tenant has no invoices in the serie")
        void shouldReturnZeroLastFolio() {
            assertEquals(0, store.lastFolio("tenant-a", "EKU"));
        }

        @Test
        @DisplayName("should return the highest folio per tenant and serie")
        void shouldReturnLastFolio() {
            store.insert(record("i1", "tenant-a", "EKU", "000002"));
            store.insert(record("i2", "tenant-a", "EKU", "000010"));
            store.insert(record("i3", "tenant-a", "VAD", "000050"));
            store.insert(record("i4", "tenant-b", "EKU", "000099"));

            assertEquals(10, store.lastFolio("tenant-a", "EKU"));
        }

        @Test
        @DisplayName("should list a tenant's invoices ordered by folio")
        void shouldListByFolio() {
            store.insert(record("i3", "tenant-a", "EKU", "000003"));
            store.insert(record("i1", "tenant-a", "EKU", "000001"));
            store.insert(record("i2", "tenant-a", "EKU", "000002"));

            List<InvoiceRecord> invoices = store.findByTenant("tenant-a");

            assertEquals("i1", invoices.get(0).getId());
            assertEquals("i3", invoices.get(2).getId());
        }

        @Test
        @DisplayName("should find an invoice by fiscal id")
        void shouldFindByFiscalId() {
            FiscalId fiscalId = FiscalId.of("7f3c2b8e-1a2d-4c5e-9f60-0a1b2c3d4e5f");
            InvoiceRecord stamped = record("i1", "tenant-a", "EKU", "000001").toBuilder()
                .fiscalId(fiscalId)
                .status(InvoiceStatus.STAMPED)
                .build();
            store.insert(stamped);

            assertEquals("i1", store.findByFiscalId(FiscalId.of("7F3C2B8E-1A2D-4C5E-9F60-0A1B2C3D4E5F"))
                .orElseThrow().getId());
        }

        @Test
        @DisplayName("should find only the stamped invoice of a payment in the tenant")
        void shouldFindStampedByPayment() {
            store.insert(record("failed", "tenant-a", "EKU", "000001").toBuilder()
                .paymentId("pay-1").status(InvoiceStatus.ERROR).build());
            store.insert(record("stamped", "tenant-a", "EKU", "000002").toBuilder()
                .paymentId("pay-1").status(InvoiceStatus.STAMPED).build());
            store.insert(record("cancelled", "tenant-a", "EKU", "000003").toBuilder()
                .paymentId("pay-2").status(InvoiceStatus.CANCELLED).build());

            assertEquals("stamped", store.findStampedByPayment("tenant-a", "pay-1").orElseThrow().getId());
            assertTrue(store.findStampedByPayment("tenant-a", "pay-2").isEmpty());
            assertTrue(store.findStampedByPayment("tenant-b", "pay-1").isEmpty());
            assertTrue(store.findStampedByPayment("tenant-a", null).isEmpty());
        }
    }

    @Nested
    @DisplayName("withFolioLock")
    class WithFolioLock {

        @Test
        @DisplayName("should hand out unique folios under concurrency")
        void shouldSerializeFolioAllocation() throws Exception {
            int threads = 10;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            Set<Integer> folios = ConcurrentHashMap.newKeySet();
            AtomicInteger ids = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    start.await();
                    return store.withFolioLock("tenant-a", () -> {
                        int next = store.lastFolio("tenant-a", "EKU") + 1;
                        folios.add(next);
                        store.insert(record("i" + ids.incrementAndGet(), "tenant-a", "EKU",
                            String.format("%06d", next)));
                        return next;
                    });
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

            assertEquals(threads, folios.size());
            assertEquals(threads, store.lastFolio("tenant-a", "EKU"));
        }

        @Test
        @DisplayName("should release the lock when the work fails")
        void shouldReleaseOnFailure() {
            assertThrows(IllegalStateException.class, () -> store.withFolioLock("tenant-a", () -> {
                throw new IllegalStateException("boom");
            }));

            assertEquals("ok", store.withFolioLock("tenant-a", () -> "ok"));
        }
    }
}

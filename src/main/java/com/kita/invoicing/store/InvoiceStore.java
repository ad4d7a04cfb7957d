package com.kita.invoicing.store;

import com.kita.invoicing.model.FiscalId;
import com.kita.invoicing.model.InvoiceRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence of issued invoices and per-tenant folio numbering
 */
public interface InvoiceStore {

    /**
     * Insert a new record
     *
     * @throws com.kita.invoicing.exception.ConflictException if (tenant, serie, folio) exists
     */
    InvoiceRecord insert(InvoiceRecord record);

    InvoiceRecord update(InvoiceRecord record);

    Optional<InvoiceRecord> findById(String id);

    Optional<InvoiceRecord> findByFiscalId(FiscalId fiscalId);

    List<InvoiceRecord> findByTenant(String tenantId);

    /**
     * Stamped invoice of a payment; cancelled and failed attempts are ignored
     */
    Optional<InvoiceRecord> findStampedByPayment(String tenantId, String paymentId);

    /**
     * Highest folio stored for a tenant and serie, 0 when none
     */
    int lastFolio(String tenantId, String serie);

    /**
     * Run work while holding the tenant's folio lock
     *
     * <p>Reading the last folio and inserting the new record must both happen
     * inside {@code work} for numbering to stay gap-free and unique.
     */
    <T> T withFolioLock(String tenantId, Supplier<T> work);
}

package com.kita.invoicing.store;

import com.kita.invoicing.exception.ConflictException;
import com.kita.invoicing.model.FiscalId;
import com.kita.invoicing.model.InvoiceRecord;
import com.kita.invoicing.model.InvoiceStatus;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory invoice store
 *
 * <p>Folio allocation is serialized per tenant with a {@link ReentrantLock};
 * a relational implementation would take a row lock on the tenant instead.
 */
public class InMemoryInvoiceStore implements InvoiceStore {

    private final Map<String, InvoiceRecord> records = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> folioLocks = new ConcurrentHashMap<>();

    @Override
    public synchronized InvoiceRecord insert(InvoiceRecord record) {
        boolean duplicate = records.values().stream()
            .anyMatch(r -> r.getTenantId().equals(record.getTenantId())
                && r.getSerie().equals(record.getSerie())
                && r.getFolio().equals(record.getFolio()));
        if (duplicate) {
            throw ConflictException.duplicateFolio(record.serieFolio());
        }
        if (records.putIfAbsent(record.getId(), record) != null) {
            throw new IllegalArgumentException("Invoice record " + record.getId() + " already exists");
        }
        return record;
    }

    @Override
    public synchronized InvoiceRecord update(InvoiceRecord record) {
        if (!records.containsKey(record.getId())) {
            throw new NoSuchElementException("Invoice record " + record.getId() + " not found");
        }
        records.put(record.getId(), record);
        return record;
    }

    @Override
    public Optional<InvoiceRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public Optional<InvoiceRecord> findByFiscalId(FiscalId fiscalId) {
        return records.values().stream()
            .filter(r -> fiscalId.equals(r.getFiscalId()))
            .findFirst();
    }

    @Override
    public List<InvoiceRecord> findByTenant(String tenantId) {
        return records.values().stream()
            .filter(r -> r.getTenantId().equals(tenantId))
            .sorted((a, b) -> Integer.compare(a.folioNumber(), b.folioNumber()))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<InvoiceRecord> findStampedByPayment(String tenantId, String paymentId) {
        return records.values().stream()
            .filter(r -> r.getTenantId().equals(tenantId)
                && paymentId != null && paymentId.equals(r.getPaymentId())
                && r.getStatus() == InvoiceStatus.STAMPED)
            .findFirst();
    }

    @Override
    public int lastFolio(String tenantId, String serie) {
        return records.values().stream()
            .filter(r -> r.getTenantId().equals(tenantId) && r.getSerie().equals(serie))
            .mapToInt(InvoiceRecord::folioNumber)
            .max()
            .orElse(0);
    }

    @Override
    public <T> T withFolioLock(String tenantId, Supplier<T> work) {
        ReentrantLock lock = folioLocks.computeIfAbsent(tenantId, k -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}

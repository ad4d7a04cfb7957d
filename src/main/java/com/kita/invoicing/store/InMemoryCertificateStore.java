package com.kita.invoicing.store;

import com.kita.invoicing.exception.ConflictException;
import com.kita.invoicing.model.CertificateRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory certificate store
 */
public class InMemoryCertificateStore implements CertificateStore {

    private final Map<String, CertificateRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized CertificateRecord insert(CertificateRecord record) {
        if (records.containsKey(record.getId())) {
            throw new IllegalArgumentException("Certificate record " + record.getId() + " already exists");
        }
        boolean duplicate = records.values().stream()
            .anyMatch(r -> r.getSerialNumber().equals(record.getSerialNumber()));
        if (duplicate) {
            throw ConflictException.duplicateSerial(record.getSerialNumber());
        }
        if (record.isActive() && record.getTaxId() != null) {
            boolean boundElsewhere = records.values().stream()
                .anyMatch(r -> r.isActive() && record.getTaxId().equals(r.getTaxId())
                    && !r.getTenantId().equals(record.getTenantId()));
            if (boundElsewhere) {
                throw ConflictException.taxIdBoundToOtherTenant(record.getTaxId());
            }
        }
        records.put(record.getId(), record);
        return record;
    }

    @Override
    public synchronized CertificateRecord update(CertificateRecord record) {
        if (!records.containsKey(record.getId())) {
            throw new NoSuchElementException("Certificate record " + record.getId() + " not found");
        }
        records.put(record.getId(), record);
        return record;
    }

    @Override
    public synchronized Optional<CertificateRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public synchronized Optional<CertificateRecord> findBySerialNumber(String serialNumber) {
        return records.values().stream()
            .filter(r -> r.getSerialNumber().equals(serialNumber))
            .findFirst();
    }

    @Override
    public synchronized Optional<CertificateRecord> findActiveByTenant(String tenantId) {
        return records.values().stream()
            .filter(r -> r.getTenantId().equals(tenantId) && r.isActive())
            .max(Comparator.comparing(CertificateRecord::getCreatedAt));
    }

    @Override
    public synchronized List<CertificateRecord> findByTenant(String tenantId) {
        return records.values().stream()
            .filter(r -> r.getTenantId().equals(tenantId))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<CertificateRecord> findWrappedWithOtherKey(String keyId) {
        return records.values().stream()
            .filter(r -> r.getEncryption() != null && !r.getEncryption().getKeyId().equals(keyId))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<CertificateRecord> findActiveByTaxId(String taxId) {
        return records.values().stream()
            .filter(r -> r.isActive() && taxId != null && taxId.equals(r.getTaxId()))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized int deactivateOthers(String tenantId, String keepId) {
        int count = 0;
        for (CertificateRecord record : new ArrayList<>(records.values())) {
            if (record.getTenantId().equals(tenantId) && record.isActive() && !record.getId().equals(keepId)) {
                records.put(record.getId(), record.deactivate());
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized List<CertificateRecord> findExpiringWithin(int days, Instant now) {
        return records.values().stream()
            .filter(r -> r.isActive() && r.expiresWithin(days, now))
            .sorted(Comparator.comparing(CertificateRecord::getValidTo))
            .collect(Collectors.toList());
    }
}

package com.kita.invoicing.store;

import com.kita.invoicing.model.CertificateRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of tenant signing certificates
 */
public interface CertificateStore {

    /**
     * Insert a new record
     *
     * <p>Both checks and the write are atomic.
     *
     * @throws com.kita.invoicing.exception.ConflictException if the serial number is already stored,
     *     or an active certificate of another tenant carries the same tax id
     */
    CertificateRecord insert(CertificateRecord record);

    /**
     * Replace an existing record by id
     */
    CertificateRecord update(CertificateRecord record);

    Optional<CertificateRecord> findById(String id);

    Optional<CertificateRecord> findBySerialNumber(String serialNumber);

    /**
     * Most recently created active certificate of a tenant
     */
    Optional<CertificateRecord> findActiveByTenant(String tenantId);

    List<CertificateRecord> findByTenant(String tenantId);

    /**
     * Records, active or not, whose data key is wrapped under a master key other than {@code keyId}
     */
    List<CertificateRecord> findWrappedWithOtherKey(String keyId);

    /**
     * Active certificates carrying a tax id, across all tenants
     */
    List<CertificateRecord> findActiveByTaxId(String taxId);

    /**
     * Deactivate every active certificate of a tenant except one
     *
     * @return number of records deactivated
     */
    int deactivateOthers(String tenantId, String keepId);

    /**
     * Active certificates expiring within a number of days
     */
    List<CertificateRecord> findExpiringWithin(int days, Instant now);
}

package com.kita.invoicing.orchestration;

import com.kita.invoicing.certificate.CertificateIdentity;
import com.kita.invoicing.certificate.CertificateValidator;
import com.kita.invoicing.certificate.ValidatedCertificate;
import com.kita.invoicing.crypto.DecryptedBundle;
import com.kita.invoicing.crypto.EnvelopeEncryptionService;
import com.kita.invoicing.exception.ConflictException;
import com.kita.invoicing.exception.DecryptionException;
import com.kita.invoicing.exception.InvoicingException;
import com.kita.invoicing.exception.ProviderException;
import com.kita.invoicing.exception.ValidationException;
import com.kita.invoicing.model.CancelRequest;
import com.kita.invoicing.model.CertificateRecord;
import com.kita.invoicing.model.CertificateUploadRequest;
import com.kita.invoicing.model.InvoiceRecord;
import com.kita.invoicing.model.InvoiceRequest;
import com.kita.invoicing.model.InvoiceResult;
import com.kita.invoicing.model.InvoiceStatus;
import com.kita.invoicing.model.TenantProfile;
import com.kita.invoicing.provider.CancellationReceipt;
import com.kita.invoicing.provider.IssuedDocument;
import com.kita.invoicing.provider.LiveCredential;
import com.kita.invoicing.provider.OrgRef;
import com.kita.invoicing.provider.ProviderAdapter;
import com.kita.invoicing.provider.ProviderRegistry;
import com.kita.invoicing.provider.ProvisionResult;
import com.kita.invoicing.store.CertificateStore;
import com.kita.invoicing.store.InvoiceStore;
import com.kita.invoicing.tax.TaxDocument;
import com.kita.invoicing.tax.TaxDocumentBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Certificate onboarding, invoice issuance and cancellation for tenants
 *
 * <p>Issuance for one tenant is serialized by the invoice store's folio lock,
 * held from reading the last folio until the stamped record is committed.
 * Different tenants issue in parallel.
 */
public class InvoicingOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(InvoicingOrchestrator.class);

    /** Issue dates and cancellation windows are in Mexico City time */
    public static final ZoneId MEXICO_CITY = ZoneId.of("America/Mexico_City");

    public static final String RECONCILIATION_REQUIRED = "RECONCILIATION_REQUIRED";
    public static final String CANCELLATION_WINDOW_CLOSED = "CANCELLATION_WINDOW_CLOSED";

    private static final Set<String> CANCELLATION_REASONS = Set.of("01", "02", "03", "04");

    private final ProviderRegistry providers;
    private final CertificateValidator certificateValidator;
    private final EnvelopeEncryptionService encryptionService;
    private final CertificateStore certificateStore;
    private final InvoiceStore invoiceStore;
    private final TenantDirectory tenantDirectory;
    private final PaymentLedger paymentLedger;
    private final NotificationDispatcher notificationDispatcher;
    private final AuditLogger auditLogger;
    private final ReconciliationLog reconciliationLog;
    private final TaxDocumentBuilder documentBuilder;
    private final Clock clock;

    private InvoicingOrchestrator(Builder builder) {
        this.providers = Objects.requireNonNull(builder.providers, "providers is required");
        this.certificateValidator = Objects.requireNonNull(builder.certificateValidator, "certificateValidator is required");
        this.encryptionService = Objects.requireNonNull(builder.encryptionService, "encryptionService is required");
        this.certificateStore = Objects.requireNonNull(builder.certificateStore, "certificateStore is required");
        this.invoiceStore = Objects.requireNonNull(builder.invoiceStore, "invoiceStore is required");
        this.tenantDirectory = Objects.requireNonNull(builder.tenantDirectory, "tenantDirectory is required");
        this.paymentLedger = Objects.requireNonNull(builder.paymentLedger, "paymentLedger is required");
        this.notificationDispatcher = Objects.requireNonNull(builder.notificationDispatcher, "notificationDispatcher is required");
        this.auditLogger = builder.auditLogger != null ? builder.auditLogger : new Slf4jAuditLogger();
        this.reconciliationLog = builder.reconciliationLog != null ? builder.reconciliationLog : new ReconciliationLog();
        this.documentBuilder = builder.documentBuilder != null ? builder.documentBuilder : new TaxDocumentBuilder();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Certificate onboarding
    // ---------------------------------------------------------------------

    /**
     * Validate, store and provision a tenant's signing certificate
     *
     * <p>Provider failures do not fail the upload: the stored record is
     * returned with {@code uploaded=false} and the provider error.
     *
     * @param request upload
     * @return stored certificate record
     * @throws com.kita.invoicing.exception.CertificateValidationException if a check fails
     * @throws ConflictException if the serial is known or the tax id belongs to another tenant
     */
    public CertificateRecord uploadCertificate(CertificateUploadRequest request) {
        TenantProfile tenant = requireTenant(request.getTenantId());
        String expectedTaxId = request.getExpectedTaxId() != null
            ? request.getExpectedTaxId() : tenant.getTaxId().getValue();
        String expectedLegalName = request.getExpectedLegalName() != null
            ? request.getExpectedLegalName() : tenant.getLegalName();

        ValidatedCertificate validated = certificateValidator.validate(request.getCertificateBytes(),
            request.getPrivateKeyBytes(), request.getPassphrase(), expectedTaxId, expectedLegalName);
        CertificateIdentity identity = validated.getIdentity();

        checkConflicts(tenant, identity);

        CertificateRecord record = CertificateRecord.builder()
            .id(UUID.randomUUID().toString())
            .tenantId(tenant.getTenantId())
            .serialNumber(identity.getSerialNumber())
            .subjectName(identity.getSubjectName())
            .issuerName(identity.getIssuerName())
            .issuerOrganization(identity.getIssuerOrganization())
            .taxId(identity.getTaxId())
            .validFrom(identity.getValidFrom())
            .validTo(identity.getValidTo())
            .encryption(encryptionService.encrypt(validated.getCertificateBytes(),
                validated.getPrivateKeyBytes(), validated.getPassphrase()))
            .active(true)
            .validated(true)
            .createdAt(clock.instant())
            .build();

        record = certificateStore.insert(record);
        int replaced = certificateStore.deactivateOthers(tenant.getTenantId(), record.getId());
        logger.info("Certificate {} stored for tenant {} ({} previous deactivated)",
            record.getSerialNumber(), tenant.getTenantId(), replaced);

        record = provision(record, tenant);

        Map<String, Object> after = new LinkedHashMap<>();
        after.put("serialNumber", record.getSerialNumber());
        after.put("taxId", record.getTaxId());
        after.put("validTo", record.getValidTo().toString());
        after.put("uploaded", record.isUploaded());
        auditLogger.log(tenant.getTenantId(), "certificate.uploaded", "certificate", record.getId(), null, after);
        return record;
    }

    /**
     * Provision the tenant's active certificate again, e.g. after a provider outage
     *
     * @param tenantId tenant
     * @return updated certificate record
     */
    public CertificateRecord retryProvisioning(String tenantId) {
        TenantProfile tenant = requireTenant(tenantId);
        CertificateRecord record = certificateStore.findActiveByTenant(tenantId)
            .orElseThrow(() -> new ValidationException("No active certificate to provision", "certificate"));
        return provision(record, tenant);
    }

    /**
     * Reject known conflicts before encrypting; {@link CertificateStore#insert} repeats both checks atomically
     */
    private void checkConflicts(TenantProfile tenant, CertificateIdentity identity) {
        if (certificateStore.findBySerialNumber(identity.getSerialNumber()).isPresent()) {
            logger.warn("Rejected upload of known certificate {} for tenant {}",
                identity.getSerialNumber(), tenant.getTenantId());
            throw ConflictException.duplicateSerial(identity.getSerialNumber());
        }
        if (identity.getTaxId() != null) {
            boolean boundElsewhere = certificateStore.findActiveByTaxId(identity.getTaxId()).stream()
                .anyMatch(other -> !other.getTenantId().equals(tenant.getTenantId()));
            if (boundElsewhere) {
                logger.warn("Rejected upload for tenant {}: tax id {} is bound to another tenant",
                    tenant.getTenantId(), identity.getTaxId());
                throw ConflictException.taxIdBoundToOtherTenant(identity.getTaxId());
            }
        }
    }

    private CertificateRecord provision(CertificateRecord record, TenantProfile tenant) {
        ProviderAdapter adapter = providers.getDefault();
        CertificateRecord current = rewrapIfNeeded(record);
        try {
            OrgRef organization = adapter.getOrCreateOrganization(tenant);
            DecryptedBundle material = encryptionService.decrypt(current);
            ProvisionResult result = adapter.provisionSigningCredential(organization, tenant, material);
            current = result.isSuccess()
                ? current.markUploaded(result.getRawResponse())
                : current.markUploadFailed(result.getMessage());
        } catch (ProviderException e) {
            logger.error("Provisioning certificate {} at {} failed: {}",
                current.getSerialNumber(), adapter.providerType().getValue(), e.getMessage());
            current = current.markUploadFailed(e.getMessage());
        }
        return certificateStore.update(current);
    }

    /**
     * Move the record's data key to the current master secret when it was wrapped under an older one
     */
    private CertificateRecord rewrapIfNeeded(CertificateRecord record) {
        if (!encryptionService.needsRewrap(record)) {
            return record;
        }
        CertificateRecord rewrapped = record.withEncryption(encryptionService.rewrap(record.getEncryption()));
        logger.info("Certificate {} rewrapped from key {} to {}",
            record.getSerialNumber(), record.getKeyId(), rewrapped.getKeyId());
        return certificateStore.update(rewrapped);
    }

    /**
     * Promote the next master key and move every stored data key to it
     *
     * @return number of records rewrapped
     * @throws IllegalStateException if no next master key is configured
     */
    public int rotateMasterKey() {
        encryptionService.getKeyRing().rotate();
        return rewrapAll();
    }

    /**
     * Move every record not wrapped under the current master key to it
     *
     * <p>Records whose old key is no longer configured are logged and left
     * unchanged; they still need that secret as a retired key.
     *
     * @return number of records rewrapped
     */
    public int rewrapAll() {
        String currentKeyId = encryptionService.getKeyRing().getCurrentKeyId();
        int rewrapped = 0;
        int failed = 0;
        for (CertificateRecord record : certificateStore.findWrappedWithOtherKey(currentKeyId)) {
            try {
                rewrapIfNeeded(certificateStore.findById(record.getId()).orElse(record));
                rewrapped++;
            } catch (DecryptionException e) {
                failed++;
                logger.error("Certificate {} of tenant {} could not be rewrapped from key {}",
                    record.getSerialNumber(), record.getTenantId(), record.getKeyId());
            }
        }
        if (failed > 0) {
            logger.warn("{} certificates remain wrapped under retired master keys", failed);
        }
        logger.info("Rewrapped {} certificates to master key {}", rewrapped, currentKeyId);
        return rewrapped;
    }

    /**
     * Notify each tenant whose active certificate expires within {@code days}
     *
     * <p>Tenants without a contact address are skipped. A failed delivery is
     * logged and does not stop the remaining notices.
     *
     * @param days look-ahead window in days
     * @return number of notices delivered
     */
    public int notifyExpiringCertificates(int days) {
        if (days < 0) {
            throw new ValidationException("days must not be negative", "days");
        }
        int delivered = 0;
        for (CertificateRecord record : certificateStore.findExpiringWithin(days, clock.instant())) {
            Optional<TenantProfile> tenant = tenantDirectory.find(record.getTenantId());
            String email = tenant.map(TenantProfile::getEmail).orElse(null);
            if (email == null || email.isBlank()) {
                logger.warn("Certificate {} of tenant {} expires {} but the tenant has no contact address",
                    record.getSerialNumber(), record.getTenantId(), record.getValidTo());
                continue;
            }
            try {
                notificationDispatcher.certificateExpiring(record, email);
                delivered++;
                logger.info("Expiry notice sent for certificate {} of tenant {} (expires {})",
                    record.getSerialNumber(), record.getTenantId(), record.getValidTo());
            } catch (RuntimeException e) {
                logger.warn("Could not send expiry notice for certificate {} of tenant {}: {}",
                    record.getSerialNumber(), record.getTenantId(), e.getMessage());
            }
        }
        return delivered;
    }

    // ---------------------------------------------------------------------
    // Issuance
    // ---------------------------------------------------------------------

    /**
     * Stamp an invoice for a payment
     *
     * @param request invoice request
     * @return stamped invoice
     * @throws ValidationException if the tenant has no usable certificate or the amounts are invalid
     * @throws ConflictException if the payment already has a stamped invoice
     * @throws ProviderException if the provider fails; an ERROR record is kept with the raw response
     * @throws InvoicingException with {@link #RECONCILIATION_REQUIRED} if the stamp succeeded but its
     *     bookkeeping did not complete; the message says whether the invoice record was stored
     */
    public InvoiceResult issueInvoice(InvoiceRequest request) {
        TenantProfile tenant = requireTenant(request.getTenantId());
        // reject bad amounts before taking the folio lock
        TaxDocumentBuilder.split(request.getAmount(), request.getTaxRate());

        Instant now = clock.instant();
        CertificateRecord certificate = certificateStore.findActiveByTenant(tenant.getTenantId())
            .filter(c -> c.isUsable(now))
            .orElseThrow(() -> new ValidationException(
                "No valid signing certificate. Upload a current CSD before issuing invoices.", "certificate"));

        ProviderAdapter adapter = providers.getDefault();
        InvoiceRecord stamped = invoiceStore.withFolioLock(tenant.getTenantId(),
            () -> issueLocked(tenant, request, certificate, adapter));

        notifyRecipient(stamped);

        Map<String, Object> after = new LinkedHashMap<>();
        after.put("serieFolio", stamped.serieFolio());
        after.put("fiscalId", stamped.getFiscalId().getValue());
        after.put("total", stamped.getTotal().toPlainString());
        after.put("paymentId", stamped.getPaymentId());
        auditLogger.log(tenant.getTenantId(), "invoice.issued", "invoice", stamped.getId(), null, after);
        return InvoiceResult.from(stamped);
    }

    private InvoiceRecord issueLocked(TenantProfile tenant, InvoiceRequest request, CertificateRecord certificate,
                                      ProviderAdapter adapter) {
        Optional<InvoiceRecord> existing = invoiceStore.findStampedByPayment(tenant.getTenantId(),
            request.getPaymentId());
        if (existing.isPresent()) {
            logger.warn("Rejected issuance for tenant {}: payment {} is already invoiced as {}",
                tenant.getTenantId(), request.getPaymentId(), existing.get().serieFolio());
            throw ConflictException.paymentAlreadyInvoiced(request.getPaymentId(), existing.get().serieFolio());
        }

        String serie = tenant.getTaxId().serie();
        int folio = invoiceStore.lastFolio(tenant.getTenantId(), serie) + 1;
        LocalDateTime issuedAt = LocalDateTime.now(clock.withZone(MEXICO_CITY));
        TaxDocument document = documentBuilder.build(tenant, request, folio, issuedAt);

        InvoiceRecord.Builder draft = InvoiceRecord.builder()
            .id(UUID.randomUUID().toString())
            .tenantId(tenant.getTenantId())
            .paymentId(request.getPaymentId())
            .serie(document.getSerie())
            .folio(document.getFolio())
            .recipientTaxId(document.getRecipient().getTaxId().getValue())
            .recipientName(document.getRecipient().getName())
            .recipientEmail(document.getRecipientEmail())
            .subtotal(document.getSubtotal())
            .tax(document.getTax())
            .total(document.getTotal())
            .currency(document.getCurrency())
            .createdAt(clock.instant());

        IssuedDocument issued;
        try {
            OrgRef organization = adapter.getOrCreateOrganization(tenant);
            LiveCredential credential = adapter.getOrCreateLiveCredential(organization);
            issued = adapter.issueDocument(organization, credential, document);
        } catch (ProviderException e) {
            InvoiceRecord failed = invoiceStore.insert(draft
                .status(InvoiceStatus.ERROR)
                .providerResponse(e.getRawResponse() != null ? e.getRawResponse() : e.getMessage())
                .build());
            logger.error("Stamping {} for tenant {} failed: {}", failed.serieFolio(), tenant.getTenantId(),
                e.getMessage());
            throw e;
        }

        InvoiceRecord stamped = draft
            .status(InvoiceStatus.STAMPED)
            .fiscalId(issued.getFiscalId())
            .providerDocumentId(issued.getDocumentId())
            .xml(issued.getXml())
            .pdf(issued.getPdf())
            .providerResponse(issued.getRawResponse())
            .stampedAt(clock.instant())
            .build();

        try {
            stamped = invoiceStore.insert(stamped);
        } catch (RuntimeException e) {
            reconciliationLog.record(new ReconciliationEntry(tenant.getTenantId(), request.getPaymentId(),
                stamped.serieFolio(), null, issued.getFiscalId(), issued.getDocumentId(), issued.getRawResponse(),
                e.getMessage(), clock.instant()));
            throw new InvoicingException("Invoice " + stamped.serieFolio() + " was stamped as "
                + issued.getFiscalId() + " but could not be recorded", RECONCILIATION_REQUIRED, e);
        }

        try {
            CertificateRecord latest = certificateStore.findById(certificate.getId()).orElse(certificate);
            certificateStore.update(latest.markUsed(clock.instant()));
            paymentLedger.markInvoiced(request.getPaymentId(), stamped.getId());
        } catch (RuntimeException e) {
            reconciliationLog.record(new ReconciliationEntry(tenant.getTenantId(), request.getPaymentId(),
                stamped.serieFolio(), stamped.getId(), issued.getFiscalId(), issued.getDocumentId(),
                issued.getRawResponse(), e.getMessage(), clock.instant()));
            throw new InvoicingException("Invoice " + stamped.serieFolio() + " was stamped as "
                + issued.getFiscalId() + " and stored as " + stamped.getId() + ", but payment "
                + request.getPaymentId() + " could not be linked to it", RECONCILIATION_REQUIRED, e);
        }

        logger.info("Invoice {} stamped for tenant {} as {}", stamped.serieFolio(), tenant.getTenantId(),
            stamped.getFiscalId());
        return stamped;
    }

    private void notifyRecipient(InvoiceRecord invoice) {
        if (invoice.getRecipientEmail() == null || invoice.getRecipientEmail().isBlank()) {
            return;
        }
        try {
            notificationDispatcher.invoiceIssued(invoice, invoice.getRecipientEmail());
        } catch (RuntimeException e) {
            // the invoice is stamped and stored; delivery can be repeated from the record
            logger.warn("Could not notify recipient of invoice {}: {}", invoice.serieFolio(), e.getMessage());
        }
    }

    // ---------------------------------------------------------------------
    // Cancellation
    // ---------------------------------------------------------------------

    /**
     * Cancel a stamped invoice
     *
     * <p>Only allowed during the calendar month it was stamped in.
     *
     * @param request cancellation request
     * @return provider receipt
     * @throws ValidationException if the invoice is unknown, not stamped or outside its cancellation window
     * @throws ProviderException if the provider fails
     */
    public CancellationReceipt cancelInvoice(CancelRequest request) {
        if (!CANCELLATION_REASONS.contains(request.getReasonCode())) {
            throw new ValidationException("Unknown cancellation reason: " + request.getReasonCode(), "reasonCode");
        }
        InvoiceRecord invoice = invoiceStore.findByFiscalId(request.getFiscalId())
            .orElseThrow(() -> new ValidationException("Invoice not found", "fiscalId"));
        if (invoice.getStatus() != InvoiceStatus.STAMPED) {
            throw new ValidationException("Only stamped invoices can be cancelled", "status");
        }
        if (!isWithinCancellationWindow(invoice)) {
            throw new ValidationException("Invoices can only be cancelled during the month they were issued",
                CANCELLATION_WINDOW_CLOSED, "stampedAt");
        }

        TenantProfile tenant = requireTenant(invoice.getTenantId());
        ProviderAdapter adapter = providers.getDefault();
        OrgRef organization = adapter.getOrCreateOrganization(tenant);
        LiveCredential credential = adapter.getOrCreateLiveCredential(organization);
        CancellationReceipt receipt = adapter.cancelDocument(organization, credential, invoice.getFiscalId(),
            request.getReasonCode(), invoice.getProviderDocumentId());

        InvoiceRecord cancelled = invoiceStore.update(invoice.cancel(clock.instant(), request.getReasonCode()));
        logger.info("Invoice {} ({}) cancelled with reason {}", cancelled.serieFolio(), cancelled.getFiscalId(),
            request.getReasonCode());

        Map<String, Object> before = new LinkedHashMap<>();
        before.put("status", invoice.getStatus().name());
        Map<String, Object> after = new LinkedHashMap<>();
        after.put("status", cancelled.getStatus().name());
        after.put("reason", request.getReasonCode());
        auditLogger.log(invoice.getTenantId(), "invoice.cancelled", "invoice", invoice.getId(), before, after);
        return receipt;
    }

    /**
     * Whether today (Mexico City) is in the month the invoice was stamped
     */
    public boolean isWithinCancellationWindow(InvoiceRecord invoice) {
        if (invoice.getStampedAt() == null) {
            return false;
        }
        YearMonth stamped = YearMonth.from(invoice.getStampedAt().atZone(MEXICO_CITY));
        return stamped.equals(YearMonth.now(clock.withZone(MEXICO_CITY)));
    }

    private TenantProfile requireTenant(String tenantId) {
        return tenantDirectory.find(tenantId)
            .orElseThrow(() -> new ValidationException("Unknown tenant: " + tenantId, "tenantId"));
    }

    public ReconciliationLog getReconciliationLog() {
        return reconciliationLog;
    }

    public static class Builder {
        private ProviderRegistry providers;
        private CertificateValidator certificateValidator;
        private EnvelopeEncryptionService encryptionService;
        private CertificateStore certificateStore;
        private InvoiceStore invoiceStore;
        private TenantDirectory tenantDirectory;
        private PaymentLedger paymentLedger;
        private NotificationDispatcher notificationDispatcher;
        private AuditLogger auditLogger;
        private ReconciliationLog reconciliationLog;
        private TaxDocumentBuilder documentBuilder;
        private Clock clock;

        public Builder providers(ProviderRegistry providers) {
            this.providers = providers;
            return this;
        }

        public Builder certificateValidator(CertificateValidator certificateValidator) {
            this.certificateValidator = certificateValidator;
            return this;
        }

        public Builder encryptionService(EnvelopeEncryptionService encryptionService) {
            this.encryptionService = encryptionService;
            return this;
        }

        public Builder certificateStore(CertificateStore certificateStore) {
            this.certificateStore = certificateStore;
            return this;
        }

        public Builder invoiceStore(InvoiceStore invoiceStore) {
            this.invoiceStore = invoiceStore;
            return this;
        }

        public Builder tenantDirectory(TenantDirectory tenantDirectory) {
            this.tenantDirectory = tenantDirectory;
            return this;
        }

        public Builder paymentLedger(PaymentLedger paymentLedger) {
            this.paymentLedger = paymentLedger;
            return this;
        }

        public Builder notificationDispatcher(NotificationDispatcher notificationDispatcher) {
            this.notificationDispatcher = notificationDispatcher;
            return this;
        }

        public Builder auditLogger(AuditLogger auditLogger) {
            this.auditLogger = auditLogger;
            return this;
        }

        public Builder reconciliationLog(ReconciliationLog reconciliationLog) {
            this.reconciliationLog = reconciliationLog;
            return this;
        }

        public Builder documentBuilder(TaxDocumentBuilder documentBuilder) {
            this.documentBuilder = documentBuilder;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public InvoicingOrchestrator build() {
            return new InvoicingOrchestrator(this);
        }
    }
}

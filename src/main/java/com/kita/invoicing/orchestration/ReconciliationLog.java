package com.kita.invoicing.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Stamped documents awaiting manual reconciliation
 *
 * <p>Every entry is also written at ERROR level so it survives a restart in
 * the application log.
 */
public class ReconciliationLog {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationLog.class);

    private final List<ReconciliationEntry> entries = new ArrayList<>();

    public synchronized void record(ReconciliationEntry entry) {
        entries.add(entry);
        logger.error("Stamped document requires reconciliation: tenant={} serieFolio={} stored={} fiscalId={} "
                + "documentId={} cause={}", entry.getTenantId(), entry.getSerieFolio(), entry.isRecordStored(),
            entry.getFiscalId(), entry.getProviderDocumentId(), entry.getFailure());
    }

    public synchronized List<ReconciliationEntry> pending() {
        return List.copyOf(entries);
    }

    /**
     * Drop an entry once its record has been repaired
     */
    public synchronized boolean resolve(ReconciliationEntry entry) {
        return entries.remove(entry);
    }
}

package com.kita.invoicing.orchestration;

import com.kita.invoicing.exception.InvoicingException;
import com.kita.invoicing.exception.ProviderException;
import com.kita.invoicing.exception.ValidationException;
import com.kita.invoicing.model.CancelRequest;
import com.kita.invoicing.model.FiscalId;
import com.kita.invoicing.provider.CancellationReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Cancellation job for an external task queue
 *
 * <p>The queue calls {@link #run(FiscalId, String, int)} with the number of
 * previous attempts and re-enqueues the job after {@link Outcome#getRetryDelay()}
 * when the outcome is {@link Status#RETRY}.
 */
public class CancellationTask {

    private static final Logger logger = LoggerFactory.getLogger(CancellationTask.class);

    public static final int MAX_ATTEMPTS = 3;
    private static final long BASE_DELAY_SECONDS = 60;

    public enum Status {
        CANCELLED,
        /** Refused by business rules or by the provider; retrying will not help */
        REJECTED,
        RETRY,
        FAILED
    }

    /**
     * Result of one run
     */
    public static final class Outcome {
        private final Status status;
        private final Duration retryDelay;
        private final String message;
        private final CancellationReceipt receipt;

        private Outcome(Status status, Duration retryDelay, String message, CancellationReceipt receipt) {
            this.status = status;
            this.retryDelay = retryDelay;
            this.message = message;
            this.receipt = receipt;
        }

        static Outcome cancelled(CancellationReceipt receipt) {
            return new Outcome(Status.CANCELLED, null, "Invoice cancelled: " + receipt.getFiscalId(), receipt);
        }

        static Outcome rejected(String message) {
            return new Outcome(Status.REJECTED, null, message, null);
        }

        static Outcome retry(Duration delay, String message) {
            return new Outcome(Status.RETRY, delay, message, null);
        }

        static Outcome failed(String message) {
            return new Outcome(Status.FAILED, null, message, null);
        }

        public Status getStatus() { return status; }

        /**
         * Delay before the next attempt, only for {@link Status#RETRY}
         */
        public Duration getRetryDelay() { return retryDelay; }
        public String getMessage() { return message; }
        public CancellationReceipt getReceipt() { return receipt; }
    }

    private final InvoicingOrchestrator orchestrator;

    public CancellationTask(InvoicingOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Attempt a cancellation
     *
     * @param fiscalId invoice to cancel
     * @param reasonCode SAT reason code
     * @param previousAttempts number of earlier runs of this job, starting at 0
     * @return outcome
     */
    public Outcome run(FiscalId fiscalId, String reasonCode, int previousAttempts) {
        try {
            CancellationReceipt receipt = orchestrator.cancelInvoice(new CancelRequest(fiscalId, reasonCode));
            return Outcome.cancelled(receipt);
        } catch (ValidationException e) {
            logger.info("Cancellation of {} rejected: {}", fiscalId, e.getMessage());
            return Outcome.rejected(e.getMessage());
        } catch (ProviderException e) {
            if (!e.isRetryable() && e.getErrorCode() != ProviderException.ProviderErrorCode.CIRCUIT_OPEN) {
                logger.warn("Provider refused cancellation of {}: {}", fiscalId, e.getMessage());
                return Outcome.rejected(e.getMessage());
            }
            return retryOrFail(fiscalId, previousAttempts, e);
        } catch (InvoicingException e) {
            return retryOrFail(fiscalId, previousAttempts, e);
        }
    }

    private Outcome retryOrFail(FiscalId fiscalId, int previousAttempts, InvoicingException e) {
        if (previousAttempts < MAX_ATTEMPTS) {
            Duration delay = retryDelay(previousAttempts);
            logger.warn("Cancellation of {} failed (attempt {}), retrying in {}s: {}",
                fiscalId, previousAttempts + 1, delay.getSeconds(), e.getMessage());
            return Outcome.retry(delay, e.getMessage());
        }
        logger.error("Cancellation of {} failed after {} retries: {}", fiscalId, MAX_ATTEMPTS, e.getMessage());
        return Outcome.failed("Failed after " + MAX_ATTEMPTS + " retries: " + e.getMessage());
    }

    /**
     * 2^attempt minutes
     */
    static Duration retryDelay(int previousAttempts) {
        return Duration.ofSeconds((1L << previousAttempts) * BASE_DELAY_SECONDS);
    }
}

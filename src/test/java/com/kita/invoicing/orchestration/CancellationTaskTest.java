package com.kita.invoicing.orchestration;

import com.kita.invoicing.exception.InvoicingException;
import com.kita.invoicing.exception.ProviderException;
import com.kita.invoicing.exception.ValidationException;
import com.kita.invoicing.model.CancelRequest;
import com.kita.invoicing.model.FiscalId;
import com.kita.invoicing.provider.CancellationReceipt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CancellationTask
 */
@ExtendWith(MockitoExtension.class)
class CancellationTaskTest {

    private static final FiscalId FISCAL_ID = FiscalId.of("7F3C2B8E-1A2D-4C5E-9F60-0A1B2C3D4E5F");

    @Mock
    private InvoicingOrchestrator orchestrator;

    private CancellationTask task;

    @BeforeEach
    void setUp() {
        task = new CancellationTask(orchestrator);
    }

    @Test
    @DisplayName("should report a successful cancellation")
    void shouldCancel() {
        CancellationReceipt receipt = new CancellationReceipt(FISCAL_ID, "inv_1", "canceled", "<Acuse/>", "{}");
        when(orchestrator.cancelInvoice(any(CancelRequest.class))).thenReturn(receipt);

        CancellationTask.Outcome outcome = task.run(FISCAL_ID, "03", 0);

        assertEquals(CancellationTask.Status.CANCELLED, outcome.getStatus());
        assertSame(receipt, outcome.getReceipt());
        assertNull(outcome.getRetryDelay());
        ArgumentCaptor<CancelRequest> request = ArgumentCaptor.forClass(CancelRequest.class);
        verify(orchestrator).cancelInvoice(request.capture());
        assertEquals(FISCAL_ID, request.getValue().getFiscalId());
        assertEquals("03", request.getValue().getReasonCode());
    }

    @Test
    @DisplayName("should not retry a business rule rejection")
    void shouldRejectValidationFailure() {
        when(orchestrator.cancelInvoice(any(CancelRequest.class))).thenThrow(new ValidationException(
            "Invoices can only be cancelled during the month they were issued",
            InvoicingOrchestrator.CANCELLATION_WINDOW_CLOSED, "stampedAt"));

        CancellationTask.Outcome outcome = task.run(FISCAL_ID, "02", 0);

        assertEquals(CancellationTask.Status.REJECTED, outcome.getStatus());
        assertTrue(outcome.getMessage().contains("month"));
    }

    @Test
    @DisplayName("should not retry a provider refusal")
    void shouldRejectProviderRefusal() {
        when(orchestrator.cancelInvoice(any(CancelRequest.class)))
            .thenThrow(ProviderException.httpStatus(400, "CFDI no cancelable", null, false));

        assertEquals(CancellationTask.Status.REJECTED, task.run(FISCAL_ID, "02", 0).getStatus());
    }

    @Test
    @DisplayName("should retry transient failures with exponential delay")
    void shouldRetryWithBackoff() {
        when(orchestrator.cancelInvoice(any(CancelRequest.class)))
            .thenThrow(ProviderException.httpStatus(503, "unavailable", null, true));

        assertEquals(Duration.ofSeconds(60), task.run(FISCAL_ID, "02", 0).getRetryDelay());
        assertEquals(Duration.ofSeconds(120), task.run(FISCAL_ID, "02", 1).getRetryDelay());
        CancellationTask.Outcome third = task.run(FISCAL_ID, "02", 2);
        assertEquals(CancellationTask.Status.RETRY, third.getStatus());
        assertEquals(Duration.ofSeconds(240), third.getRetryDelay());
    }

    @Test
    @DisplayName("should retry while the circuit is open")
    void shouldRetryOpenCircuit() {
        when(orchestrator.cancelInvoice(any(CancelRequest.class))).thenThrow(ProviderException.circuitOpen(30));

        assertEquals(CancellationTask.Status.RETRY, task.run(FISCAL_ID, "02", 0).getStatus());
    }

    @Test
    @DisplayName("should retry other local failures")
    void shouldRetryInvoicingFailure() {
        when(orchestrator.cancelInvoice(any(CancelRequest.class)))
            .thenThrow(new InvoicingException("store unavailable", "STORE_ERROR"));

        assertEquals(CancellationTask.Status.RETRY, task.run(FISCAL_ID, "02", 1).getStatus());
    }

    @Test
    @DisplayName("should fail after the last retry")
    void shouldFailAfterMaxAttempts() {
        when(orchestrator.cancelInvoice(any(CancelRequest.class)))
            .thenThrow(ProviderException.httpStatus(503, "unavailable", null, true));

        CancellationTask.Outcome outcome = task.run(FISCAL_ID, "02", CancellationTask.MAX_ATTEMPTS);

        assertEquals(CancellationTask.Status.FAILED, outcome.getStatus());
        assertTrue(outcome.getMessage().startsWith("Failed after 3 retries"));
    }
}

package com.synergi.core.execution;

import com.synergi.core.config.SynergiProperties;
import com.synergi.core.ledger.SettlementLedger;
import com.synergi.core.metrics.SynergiMetrics;
import com.synergi.core.model.FailureKind;
import com.synergi.core.model.PlannedStep;
import com.synergi.core.model.SettlementReceipt;
import com.synergi.core.model.SettlementRecord;
import com.synergi.core.model.WorkerEntry;
import com.synergi.core.model.WorkerResponse;
import com.synergi.core.registry.WorkerRegistry;
import com.synergi.core.settlement.SettlementCollaborator;
import com.synergi.core.settlement.SettlementTimeoutException;
import com.synergi.core.worker.WorkerInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Performs one paid attempt at a step: call the worker, pay it, record the settlement.
 * <p>
 * Payment happens only after the worker delivers. Any failure of either call, including a
 * missed deadline, surfaces as a {@link StepFailureException}; nothing is appended to the
 * ledger in that case.
 */
@Component
public class StepInvoker {

    private static final Logger log = LoggerFactory.getLogger(StepInvoker.class);

    private final WorkerInvoker workerInvoker;
    private final SettlementCollaborator settlement;
    private final SettlementLedger ledger;
    private final WorkerRegistry registry;
    private final DelegationIngestor delegationIngestor;
    private final CallGuard callGuard;
    private final SynergiMetrics metrics;
    private final Duration workerTimeout;
    private final Duration settlementTimeout;

    public StepInvoker(WorkerInvoker workerInvoker, SettlementCollaborator settlement, SettlementLedger ledger,
                       WorkerRegistry registry, DelegationIngestor delegationIngestor, CallGuard callGuard,
                       SynergiMetrics metrics, SynergiProperties properties) {
        this.workerInvoker = workerInvoker;
        this.settlement = settlement;
        this.ledger = ledger;
        this.registry = registry;
        this.delegationIngestor = delegationIngestor;
        this.callGuard = callGuard;
        this.metrics = metrics;
        this.workerTimeout = properties.getOrchestration().getTimeouts().getWorker();
        this.settlementTimeout = properties.getOrchestration().getTimeouts().getSettlement();
    }

    /**
     * @param originalWorkerId the failed worker this attempt replaces, or null for the first attempt
     * @throws StepFailureException   if the worker call or the payment fails
     * @throws TaskCancelledException if the task is cancelled meanwhile
     */
    public AttemptResult attempt(ExecutionContext ctx, PlannedStep step, WorkerEntry worker, String originalWorkerId) {
        WorkerResponse response;
        try {
            response = callGuard.call("worker " + worker.id(), workerTimeout, ctx.token(),
                    t -> workerInvoker.call(worker, step, t));
        } catch (TaskCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            registry.recordOutcome(worker.id(), false, null);
            throw new StepFailureException(FailureKind.WORKER_CALL_FAILURE, worker.id(),
                    "Worker " + worker.id() + " failed: " + e.getMessage(), e);
        }

        SettlementReceipt receipt;
        try {
            receipt = callGuard.call("settlement", settlementTimeout, ctx.token(),
                    t -> settlement.pay(worker.address(), worker.price(), ctx.requesterId(), t));
        } catch (TaskCancelledException e) {
            throw e;
        } catch (CollaboratorTimeoutException e) {
            var timeout = new SettlementTimeoutException("Settlement with " + worker.id() + " timed out", e);
            throw new StepFailureException(FailureKind.SETTLEMENT_TIMEOUT, worker.id(), timeout.getMessage(), timeout);
        } catch (RuntimeException e) {
            throw new StepFailureException(FailureKind.SETTLEMENT_ERROR, worker.id(),
                    "Settlement with " + worker.id() + " failed: " + e.getMessage(), e);
        }

        SettlementRecord record = ledger.append(SettlementRecord.direct(ctx.taskId(), step.capabilityId(),
                ctx.requesterId(), worker.id(), worker.price(), receipt.transactionId(),
                originalWorkerId != null, originalWorkerId));
        ctx.recordDirect(record);
        registry.recordOutcome(worker.id(), true, worker.price());
        metrics.recordSettlement(record.amount(), false);
        log.info("Paid {} {} for {} (record #{}, tx {})",
                worker.id(), worker.price(), step.capabilityId(), record.id(), receipt.transactionId());
        String explorer = settlement.explorerUrl(receipt.transactionId());
        if (explorer != null) {
            log.info("Explorer: {}", explorer);
        }

        DelegationIngestor.Result delegated = delegationIngestor.ingest(ctx, record, response.nestedHires());
        return new AttemptResult(worker, response, record, delegated.appended(), delegated.refused());
    }
}

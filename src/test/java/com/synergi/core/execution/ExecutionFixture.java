package com.synergi.core.execution;

import com.synergi.core.config.SynergiProperties;
import com.synergi.core.events.EventBus;
import com.synergi.core.hiring.HiringDecisionEngine;
import com.synergi.core.ledger.SettlementLedger;
import com.synergi.core.metrics.SynergiMetrics;
import com.synergi.core.registry.EfficiencyScorer;
import com.synergi.core.registry.WorkerRegistration;
import com.synergi.core.registry.WorkerRegistry;
import com.synergi.core.settlement.SettlementCollaborator;
import com.synergi.core.settlement.SimulatedSettlementClient;
import com.synergi.core.worker.StepResultDecoder;
import com.synergi.core.worker.WorkerInvoker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Real execution stack over a scripted worker client and simulated settlement.
 */
class ExecutionFixture implements AutoCloseable {

    final ExecutorService executor = Executors.newCachedThreadPool();
    final SynergiProperties properties = new SynergiProperties();
    final WorkerRegistry registry = new WorkerRegistry(new EfficiencyScorer(1.0, 0.001));
    final SettlementLedger ledger = new SettlementLedger();
    final EventBus eventBus = new EventBus();
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    final SynergiMetrics metrics = new SynergiMetrics(meterRegistry);
    final ScriptedWorkerClient workers = new ScriptedWorkerClient();
    final CallGuard callGuard = new CallGuard(executor);

    SettlementCollaborator settlement = new SimulatedSettlementClient("testnet");
    int maxRetries = 2;
    int maxDelegationDepth = 3;

    ExecutionFixture() {
        properties.getOrchestration().getTimeouts().setWorker(Duration.ofMillis(500));
        properties.getOrchestration().getTimeouts().setSettlement(Duration.ofMillis(500));
    }

    ExecutionFixture worker(String id, String category, String price, int reputation) {
        registry.register(new WorkerRegistration(id, id, category, new BigDecimal(price), reputation));
        return this;
    }

    StepInvoker stepInvoker() {
        var invoker = new WorkerInvoker(List.of(workers), new StepResultDecoder());
        var ingestor = new DelegationIngestor(ledger, registry, metrics, maxDelegationDepth);
        return new StepInvoker(invoker, settlement, ledger, registry, ingestor, callGuard, metrics, properties);
    }

    ExecutionCoordinator coordinator() {
        StepInvoker stepInvoker = stepInvoker();
        var selfHealing = new SelfHealingController(stepInvoker, new DegradedResultFactory(), metrics);
        return new ExecutionCoordinator(registry, new HiringDecisionEngine(), stepInvoker, selfHealing,
                eventBus, metrics, maxRetries);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}

package com.synergi.core.ledger;

import com.synergi.core.events.EventBus;
import com.synergi.core.events.SynergiEvent;
import com.synergi.core.model.SettlementRecord;
import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Forwards every ledger append to the {@link EventBus} as a {@code payment} or
 * {@code delegated-hire} event.
 */
@Component
public class LedgerEventPublisher {

    private final EventBus.Subscription subscription;

    public LedgerEventPublisher(SettlementLedger ledger, EventBus eventBus) {
        this.subscription = ledger.subscribe(record -> eventBus.publish(toEvent(record)));
    }

    @PreDestroy
    void stop() {
        subscription.unsubscribe();
    }

    static SynergiEvent toEvent(SettlementRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recordId", record.id());
        payload.put("capability", record.capabilityId());
        payload.put("payer", record.payerId());
        payload.put("worker", record.workerId());
        payload.put("amount", record.amount().toPlainString());
        payload.put("transactionId", record.transactionId());
        payload.put("depth", record.depth());
        if (record.parentRecordId() != null) {
            payload.put("parentRecordId", record.parentRecordId());
        }
        if (record.selfHealed()) {
            payload.put("selfHealed", true);
            payload.put("originalWorkerId", record.originalWorkerId());
        }
        String type = record.delegated() ? SynergiEvent.DELEGATED_HIRE : SynergiEvent.PAYMENT;
        return new SynergiEvent(type, record.taskId(), null, payload, record.timestamp());
    }
}

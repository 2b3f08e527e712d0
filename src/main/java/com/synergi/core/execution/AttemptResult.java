package com.synergi.core.execution;

import com.synergi.core.model.SettlementRecord;
import com.synergi.core.model.WorkerEntry;
import com.synergi.core.model.WorkerResponse;

import java.util.List;

/**
 * A paid, successful call to one worker.
 *
 * @param worker the worker that was paid
 * @param response its decoded reply
 * @param settlement depth-0 ledger record
 * @param nestedHires delegated records appended beneath {@code settlement}
 * @param refusedHires reported hires that were not accepted
 */
public record AttemptResult(
    WorkerEntry worker,
    WorkerResponse response,
    SettlementRecord settlement,
    List<SettlementRecord> nestedHires,
    List<String> refusedHires
) {
}

package com.synergi.core.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.List;

/**
 * A sub-hire reported by a worker that acted as a hirer while serving a step.
 *
 * @param workerId worker that was hired
 * @param capabilityId capability it was hired for
 * @param amount amount the hiring worker paid
 * @param transactionId settlement reference reported by the hiring worker, if any
 * @param nested hires made in turn by {@code workerId}
 */
public record NestedHire(
    String workerId,
    String capabilityId,
    BigDecimal amount,
    String transactionId,
    List<NestedHire> nested
) implements Serializable {

    public NestedHire {
        nested = nested == null ? List.of() : List.copyOf(nested);
    }
}

package com.synergi.core.settlement;

import com.synergi.core.config.SynergiProperties;
import com.synergi.core.execution.CancellationToken;
import com.synergi.core.model.SettlementReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Settles instantly with a generated {@code sim_tx_<worker>_<hex>} transaction id.
 */
@Component
@ConditionalOnProperty(prefix = "synergi.settlement", name = "mode", havingValue = "simulated", matchIfMissing = true)
public class SimulatedSettlementClient implements SettlementCollaborator {

    private static final Logger log = LoggerFactory.getLogger(SimulatedSettlementClient.class);

    private final SecureRandom random = new SecureRandom();
    private final String network;

    @Autowired
    public SimulatedSettlementClient(SynergiProperties properties) {
        this(properties.getSettlement().getNetwork());
    }

    public SimulatedSettlementClient(String network) {
        this.network = network;
    }

    @Override
    public SettlementReceipt pay(String workerAddress, BigDecimal amount, String payerId, CancellationToken token) {
        token.throwIfCancelled();
        if (amount.signum() < 0) {
            throw new SettlementException("Cannot settle a negative amount: " + amount);
        }
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        String slug = workerAddress.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        String transactionId = "sim_tx_" + slug + "_" + HexFormat.of().formatHex(bytes);
        log.debug("Simulated settlement {} -> {} {} ({})", payerId, workerAddress, amount, transactionId);
        return new SettlementReceipt(transactionId, payerId, amount, network);
    }

    @Override
    public String mode() {
        return "simulated";
    }
}

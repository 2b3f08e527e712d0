package com.synergi.core.settlement;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.synergi.core.config.SynergiProperties;
import com.synergi.core.execution.CancellationToken;
import com.synergi.core.model.SettlementReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Settles through a payment facilitator over HTTP.
 * <p>
 * POSTs {@code {payTo, amount, payer, network, asset}} to {@code <facilitator-url>/settle} and
 * expects {@code {success, transaction, payer}} back. The asset is STX unless sBTC is configured.
 */
@Component
@ConditionalOnProperty(prefix = "synergi.settlement", name = "mode", havingValue = "facilitator")
public class FacilitatorSettlementClient implements SettlementCollaborator {

    private static final Logger log = LoggerFactory.getLogger(FacilitatorSettlementClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String facilitatorUrl;
    private final String network;
    private final String asset;
    private final String explorerBase;

    public FacilitatorSettlementClient(@Qualifier("collaboratorHttpClient") HttpClient httpClient,
                                       ObjectMapper objectMapper,
                                       SynergiProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.facilitatorUrl = stripTrailingSlash(properties.getSettlement().getFacilitatorUrl());
        this.network = properties.getSettlement().getNetwork();
        this.asset = resolveAsset(properties.getSettlement().getAsset());
        this.explorerBase = stripTrailingSlash(properties.getSettlement().getExplorerUrl());
        log.info("Facilitator settlement enabled at {} (network {}, asset {})", facilitatorUrl, network, asset);
    }

    @Override
    public SettlementReceipt pay(String workerAddress, BigDecimal amount, String payerId, CancellationToken token) {
        Map<String, Object> payload = settlePayload(workerAddress, amount, payerId);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(facilitatorUrl + "/settle"))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
                    .build();
        } catch (IOException e) {
            throw new SettlementException("Cannot encode settlement request: " + e.getMessage(), e);
        }

        CompletableFuture<HttpResponse<String>> pending =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        CancellationToken.Registration hook = token.onCancel(() -> pending.cancel(true));
        HttpResponse<String> response;
        try {
            response = pending.get();
        } catch (CancellationException e) {
            throw new SettlementException("Settlement to " + workerAddress + " was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SettlementException("Interrupted while settling with " + workerAddress, e);
        } catch (ExecutionException e) {
            throw new SettlementException("Facilitator unreachable: " + e.getCause().getMessage(), e.getCause());
        } finally {
            hook.remove();
        }

        if (response.statusCode() >= 400) {
            throw new SettlementException("Facilitator returned HTTP " + response.statusCode()
                    + " for payment to " + workerAddress);
        }
        try {
            JsonNode body = objectMapper.readTree(response.body());
            if (body.has("success") && !body.get("success").asBoolean()) {
                throw new SettlementException("Facilitator rejected payment to " + workerAddress + ": "
                        + body.path("errorReason").asText("unknown reason"));
            }
            String transaction = body.path("transaction").asText(null);
            if (transaction == null || transaction.isBlank()) {
                throw new SettlementException("Facilitator response has no transaction id");
            }
            String payer = body.path("payer").asText(payerId);
            return new SettlementReceipt(transaction, payer, amount, network);
        } catch (IOException e) {
            throw new SettlementException("Facilitator returned invalid JSON: " + e.getMessage(), e);
        }
    }

    @Override
    public String mode() {
        return "facilitator";
    }

    @Override
    public String explorerUrl(String transactionId) {
        return explorerBase + "/txid/" + transactionId + "?chain=" + network;
    }

    Map<String, Object> settlePayload(String workerAddress, BigDecimal amount, String payerId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("payTo", workerAddress);
        payload.put("amount", amount.toPlainString());
        payload.put("payer", payerId);
        payload.put("network", network);
        payload.put("asset", asset);
        return payload;
    }

    static String resolveAsset(String configured) {
        if (configured == null || configured.isBlank()) {
            return "STX";
        }
        String normalized = configured.trim().toUpperCase(Locale.ROOT);
        if ("SBTC".equals(normalized)) {
            return "sBTC";
        }
        if (!"STX".equals(normalized)) {
            log.warn("Unknown settlement asset '{}', paying in STX", configured);
        }
        return "STX";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

package com.synergi.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: synergi ledger
 * <p>
 * The ledger lives in the server process, so this reads it over HTTP.
 */
@Command(name = "ledger", mixinStandardHelpOptions = true, description = "Show recent settlements from a running server")
@Component
public class LedgerCommand implements Callable<Integer> {

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    @Option(names = {"--limit", "-n"}, description = "Number of records (default: ${DEFAULT-VALUE})", defaultValue = "20")
    private int limit;

    private final ObjectMapper objectMapper;

    public LedgerCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        URI uri = URI.create("http://localhost:" + port + "/api/v1/ledger?limit=" + limit);
        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .build();
            HttpResponse<String> response = client.send(
                    HttpRequest.newBuilder().uri(uri).GET().build(),
                    HttpResponse.BodyHandlers.ofString());

            JsonNode body = objectMapper.readTree(response.body());
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode() + ": "
                        + body.path("error").asText(""));
                return 1;
            }

            JsonNode stats = body.path("stats");
            ConsoleOutput.info(String.format("%d settlement(s), volume %s (delegated %d / %s), max depth %d",
                    stats.path("count").asInt(), stats.path("totalVolume").asText(),
                    stats.path("delegatedCount").asInt(), stats.path("delegatedVolume").asText(),
                    stats.path("maxDepth").asInt()));
            System.out.println();
            System.out.printf("  %-5s %-14s %-16s %-16s %-9s %-5s %s%n",
                    "ID", "TASK", "PAYER", "WORKER", "AMOUNT", "DEPTH", "TX");
            System.out.println("  " + "-".repeat(90));
            for (JsonNode r : body.path("records")) {
                System.out.printf("  %-5d %-14s %-16s %-16s %-9s %-5d %s%n",
                        r.path("id").asLong(), r.path("taskId").asText(), r.path("payerId").asText(),
                        r.path("workerId").asText(), r.path("amount").asText(),
                        r.path("depth").asInt(), r.path("transactionId").asText());
            }
            return 0;
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Synergi server at localhost:" + port);
            ConsoleOutput.info("Start the server first: synergi serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (IOException e) {
            ConsoleOutput.error("Ledger query failed: " + e.getMessage());
            return 1;
        }
    }
}

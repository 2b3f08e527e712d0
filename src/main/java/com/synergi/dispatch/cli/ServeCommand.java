package com.synergi.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: synergi serve
 * <p>
 * The web server is switched on by {@link com.synergi.SynergiApplication#main} seeing "serve"
 * in the arguments, and {@link CliRunner} then skips picocli. The banner is printed once the
 * server has bound its port. Set the port with {@code SERVER_PORT=9090 synergi serve}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Synergi HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // reached only through --help style invocations, serve mode bypasses picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Synergi server running on port " + port);
        System.out.println();
        System.out.println("  Tasks:    http://localhost:" + port + "/api/v1/tasks");
        System.out.println("  Events:   http://localhost:" + port + "/api/v1/events");
        System.out.println("  Registry: http://localhost:" + port + "/api/v1/registry");
        System.out.println("  Ledger:   http://localhost:" + port + "/api/v1/ledger");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}

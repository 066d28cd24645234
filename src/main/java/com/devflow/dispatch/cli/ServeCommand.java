package com.devflow.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: devflow serve
 * <p>
 * Starts devflow as a long-running HTTP server exposing the execution and batch REST API
 * with SSE streaming. {@link CliRunner} skips picocli in this mode; the banner is printed
 * once the web server is up.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the devflow HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // only reached for --help style invocations
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("devflow server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1/executions");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}

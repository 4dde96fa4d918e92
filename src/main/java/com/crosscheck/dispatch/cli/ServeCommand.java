package com.crosscheck.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: crosscheck serve
 * <p>
 * Starts Crosscheck as a long-running HTTP server. The web server is enabled by
 * {@link com.crosscheck.CrosscheckApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode. The banner is printed once Tomcat is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 crosscheck serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Crosscheck HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Crosscheck server running on port " + port);
        System.out.println();
        System.out.println("  Tasks:        http://localhost:" + port + "/api/v1/tasks");
        System.out.println("  Escalations:  http://localhost:" + port + "/api/v1/escalations");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}

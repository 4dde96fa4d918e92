package com.crosscheck.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.net.ConnectException;

/**
 * CLI command: crosscheck escalations
 */
@Command(name = "escalations", mixinStandardHelpOptions = true,
        description = "List escalations awaiting a human decision")
@Component
public class EscalationsCommand implements Runnable {

    @Option(names = "--port", defaultValue = "8080", description = "Server port (default: 8080)")
    private int port;

    private final CrosscheckClient client;

    public EscalationsCommand(CrosscheckClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        CrosscheckClient.ApiResponse response;
        try {
            response = client.get(port, "/api/v1/escalations");
        } catch (ConnectException e) {
            ConsoleOutput.cannotConnect(port);
            return;
        } catch (IOException e) {
            ConsoleOutput.error("Request failed: " + e.getMessage());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted");
            return;
        }

        if (response.status() != 200) {
            ConsoleOutput.error("Error: " + response.error());
            return;
        }

        JsonNode escalations = response.body();
        if (!escalations.isArray() || escalations.isEmpty()) {
            ConsoleOutput.success("No open escalations");
            return;
        }
        ConsoleOutput.info(escalations.size() + " open escalation(s)");
        for (JsonNode escalation : escalations) {
            ConsoleOutput.escalation(
                    escalation.path("task_id").asText(),
                    escalation.path("reason").asText(),
                    escalation.path("rejection_count").asInt(),
                    escalation.path("recommendation").asText(""));
        }
    }
}

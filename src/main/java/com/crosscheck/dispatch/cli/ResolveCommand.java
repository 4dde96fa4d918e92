package com.crosscheck.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CLI command: crosscheck resolve &lt;task-id&gt; --resolution RETRY_RESET
 */
@Command(name = "resolve", mixinStandardHelpOptions = true,
        description = "Resolve the open escalation of a task")
@Component
public class ResolveCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"-r", "--resolution"}, required = true,
            description = "RETRY_RESET, ABORT or FORCE_ACCEPT")
    private String resolution;

    @Option(names = "--reviewer", defaultValue = "cli", description = "Name recorded as the resolver")
    private String reviewer;

    @Option(names = "--note", description = "Free-text note stored with the resolution")
    private String note;

    @Option(names = "--port", defaultValue = "8080", description = "Server port (default: 8080)")
    private int port;

    private final CrosscheckClient client;

    public ResolveCommand(CrosscheckClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("resolution", resolution);
        body.put("reviewer", reviewer);
        if (note != null) {
            body.put("note", note);
        }

        CrosscheckClient.ApiResponse response;
        try {
            response = client.post(port, "/api/v1/escalations/" + taskId + "/resolution", body);
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

        switch (response.status()) {
            case 202 -> ConsoleOutput.success("Submitted " + response.body().path("resolution").asText(resolution)
                    + " for task " + taskId);
            case 404 -> ConsoleOutput.error("No escalation for task " + taskId + ": " + response.error());
            case 409 -> ConsoleOutput.warn("Escalation already resolved: " + response.error());
            default -> ConsoleOutput.error("Error: " + response.error());
        }
    }
}

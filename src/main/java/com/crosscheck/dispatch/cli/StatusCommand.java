package com.crosscheck.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;

/**
 * CLI command: crosscheck status &lt;task-id&gt;
 * <p>
 * Queries a running server for a task's state and validation history.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the state of a task")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = "--port", defaultValue = "8080", description = "Server port (default: 8080)")
    private int port;

    private final CrosscheckClient client;

    public StatusCommand(CrosscheckClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        CrosscheckClient.ApiResponse response;
        try {
            response = client.get(port, "/api/v1/tasks/" + taskId);
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

        if (response.status() == 404) {
            ConsoleOutput.error("Task " + taskId + " not found");
            return;
        }
        if (response.status() != 200) {
            ConsoleOutput.error("Error: " + response.error());
            return;
        }

        JsonNode task = response.body();
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Task: " + task.path("task_id").asText(taskId));
        System.out.println("  Component:  " + task.path("component_id").asText());
        ConsoleOutput.state("  State:     ", task.path("state").asText());
        System.out.println("  Retries:    " + task.path("retry_count").asInt()
                + "/" + task.path("max_retries").asInt()
                + " (round " + task.path("round").asInt() + ")");
        if (!task.path("owner_agent_id").isMissingNode() && !task.path("owner_agent_id").isNull()) {
            System.out.println("  Owner:      " + task.path("owner_agent_id").asText());
        }
        if (!task.path("failure_reason").isMissingNode() && !task.path("failure_reason").isNull()) {
            System.out.println("  Failure:    " + task.path("failure_reason").asText()
                    + " " + task.path("failure_detail").asText(""));
        }

        JsonNode attempts = task.path("attempt_history");
        if (attempts.isArray() && !attempts.isEmpty()) {
            System.out.println();
            System.out.println("  Attempts:");
            for (JsonNode attempt : attempts) {
                ConsoleOutput.attempt(
                        attempt.path("round").asInt(),
                        attempt.path("attempt_number").asInt(),
                        attempt.path("result").asText(),
                        attempt.path("validator_id").asText(),
                        attempt.path("feedback").asText(""));
            }
        }
    }
}

package com.crosscheck.dispatch.cli;

import com.crosscheck.core.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: crosscheck health
 * <p>
 * Runs the local health checks and prints the results.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return;
        }

        boolean allUp = true;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
    }
}

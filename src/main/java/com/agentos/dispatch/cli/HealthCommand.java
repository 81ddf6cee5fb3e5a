package com.agentos.dispatch.cli;

import com.agentos.core.health.HealthCheckService;
import com.agentos.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: agentos health
 * <p>
 * Exit code 0 when every component is up, 1 otherwise.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check models, goal directories and roster")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String line = String.format("%-8s %s", check.component(), check.detail());
            if (check.status() == HealthStatus.Status.UP) {
                ConsoleOutput.success(line);
            } else if (check.status() == HealthStatus.Status.DEGRADED) {
                ConsoleOutput.warn(line);
            } else {
                ConsoleOutput.error(line);
            }
            check.metadata().forEach((key, problem) -> System.out.println("           " + key + ": " + problem));
        }

        long notUp = checks.stream().filter(c -> c.status() != HealthStatus.Status.UP).count();
        System.out.println("──────────────────────────────────");
        if (notUp == 0) {
            ConsoleOutput.success(checks.size() + " component(s) up");
            return 0;
        }
        ConsoleOutput.error(notUp + " of " + checks.size() + " component(s) degraded or down");
        return 1;
    }
}

package com.agentos.dispatch.cli;

import com.agentos.core.cost.CostSummary;
import com.agentos.core.cost.CostTracker;
import com.agentos.core.cost.DailyCost;
import com.agentos.core.llm.ModelDefinition;
import com.agentos.core.llm.ModelRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: agentos models [--days &lt;n&gt;]
 * <p>
 * Lists configured model aliases with pricing and availability, then the recorded spend:
 * month to date, and per day, stage and model over the last {@code n} days.
 */
@Command(name = "models", mixinStandardHelpOptions = true, description = "List configured models")
@Component
public class ModelsCommand implements Runnable {

    @Option(names = {"--days", "-d"}, defaultValue = "7", description = "Days of daily spend to show (default: 7)")
    private int days;

    private final ModelRegistry registry;
    private final CostTracker costTracker;

    public ModelsCommand(ModelRegistry registry, @Autowired(required = false) CostTracker costTracker) {
        this.registry = registry;
        this.costTracker = costTracker;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        System.out.printf("  %-16s %-10s %-32s %10s %10s  %s%n",
                "ALIAS", "PROVIDER", "MODEL", "IN/1K", "OUT/1K", "STATUS");
        for (ModelRegistry.Entry entry : registry.entries()) {
            ModelDefinition def = entry.definition();
            String status = entry.available() ? "available" : "unavailable (" + entry.unavailableReason() + ")";
            System.out.printf("  %-16s %-10s %-32s %10.4f %10.4f  %s%n",
                    def.alias(), def.provider(), def.modelId(),
                    def.pricing().inputPer1k(), def.pricing().outputPer1k(), status);
        }
        if (costTracker != null) {
            CostSummary month = costTracker.monthToDate();
            System.out.println("──────────────────────────────────");
            ConsoleOutput.info(String.format("Spend this month: %.4f %s over %d call(s)",
                    month.total(), costTracker.currency(), month.calls()));
            List<DailyCost> daily = costTracker.dailyReport(Math.max(0, days));
            if (!daily.isEmpty()) {
                System.out.printf("  %-10s %-10s %-16s %10s %10s %12s%n",
                        "DATE", "STAGE", "MODEL", "IN", "OUT", "COST");
                for (DailyCost d : daily) {
                    System.out.printf("  %-10s %-10s %-16s %10d %10d %12.4f%n",
                            d.date(), d.stage(), d.modelAlias(), d.inputTokens(), d.outputTokens(), d.cost());
                }
            }
        }
    }
}

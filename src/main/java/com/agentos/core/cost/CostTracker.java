package com.agentos.core.cost;

import com.agentos.core.config.AgentOsProperties;
import com.agentos.core.events.AgentOsEvent;
import com.agentos.core.events.EventBus;
import com.agentos.core.llm.ModelPricing;
import com.agentos.core.llm.PipelineStage;
import com.agentos.core.source.GoalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Accounting of model spend over a {@link CostStore}. Every figure is read back from the
 * store, so a new tracker over the same database sees spend logged by earlier processes.
 * <p>
 * Raises a single budget alert per month once month-to-date spend crosses the configured
 * percentage of the monthly budget.
 */
@Service
@ConditionalOnProperty(prefix = "agentos.cost-tracking", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CostTracker implements CostSink {

    private static final Logger log = LoggerFactory.getLogger(CostTracker.class);

    private final AgentOsProperties.CostTracking settings;
    private final CostStore store;
    private final EventBus eventBus;
    private final GoalSource goalSource;
    private final Clock clock;

    private final AtomicBoolean alerted = new AtomicBoolean(false);
    private YearMonth alertMonth;

    @Autowired
    public CostTracker(AgentOsProperties properties,
                       CostStore store,
                       @Autowired(required = false) EventBus eventBus,
                       @Autowired(required = false) GoalSource goalSource) {
        this(properties.getCostTracking(), store, eventBus, goalSource, Clock.systemUTC());
    }

    public CostTracker(AgentOsProperties.CostTracking settings, CostStore store, EventBus eventBus,
                       GoalSource goalSource, Clock clock) {
        this.settings = settings;
        this.store = store;
        this.eventBus = eventBus;
        this.goalSource = goalSource;
        this.clock = clock;
    }

    @Override
    public void logCall(PipelineStage stage, String modelAlias, long inputTokens, long outputTokens,
                        ModelPricing pricing) {
        double cost = pricing.estimateCost(inputTokens, outputTokens);
        store.append(new CostRecord(clock.instant(), stage, modelAlias, inputTokens, outputTokens, cost));
        checkBudget();
    }

    public CostSummary summary() {
        return summarize(store.findAll());
    }

    public CostSummary monthToDate() {
        Instant monthStart = currentMonth().atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        return summarize(store.findSince(monthStart));
    }

    /**
     * Spend per UTC day, stage and model over today and the {@code days} days before it,
     * newest day first.
     */
    public List<DailyCost> dailyReport(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must be >= 0, got " + days);
        }
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        Instant from = today.minusDays(days).atStartOfDay(ZoneOffset.UTC).toInstant();

        var report = new TreeMap<DayKey, DailyCost>();
        for (CostRecord r : store.findSince(from)) {
            LocalDate day = LocalDate.ofInstant(r.timestamp(), ZoneOffset.UTC);
            report.merge(new DayKey(day, r.stage().configKey(), r.modelAlias()),
                    new DailyCost(day, r.stage().configKey(), r.modelAlias(), r.inputTokens(), r.outputTokens(),
                            r.cost()),
                    DailyCost::plus);
        }
        return List.copyOf(report.values());
    }

    public boolean isOverBudget(double monthlyBudget) {
        return monthToDate().total() >= monthlyBudget;
    }

    public String currency() {
        return settings.getCurrency();
    }

    private void checkBudget() {
        double budget = settings.getMonthlyBudget();
        if (budget <= 0) {
            return;
        }
        YearMonth month = currentMonth();
        synchronized (alerted) {
            if (!month.equals(alertMonth)) {
                alertMonth = month;
                alerted.set(false);
            }
        }
        double spent = monthToDate().total();
        double threshold = budget * settings.getAlertAtPercent() / 100.0;
        if (spent >= threshold && alerted.compareAndSet(false, true)) {
            String message = String.format("Model spend %.4f %s has reached %d%% of the monthly budget %.2f %s",
                    spent, settings.getCurrency(), settings.getAlertAtPercent(), budget, settings.getCurrency());
            log.warn(message);
            if (eventBus != null) {
                eventBus.publish(AgentOsEvent.of("cost.alert", null, null,
                        Map.of("spent", spent, "budget", budget, "currency", settings.getCurrency())));
            }
            if (goalSource != null) {
                try {
                    goalSource.notify(message);
                } catch (RuntimeException e) {
                    log.warn("Failed to deliver budget alert: {}", e.getMessage());
                }
            }
        }
    }

    private YearMonth currentMonth() {
        return YearMonth.from(Instant.now(clock).atZone(ZoneOffset.UTC));
    }

    private record DayKey(LocalDate date, String stage, String modelAlias) implements Comparable<DayKey> {

        private static final Comparator<DayKey> ORDER = Comparator.comparing(DayKey::date).reversed()
                .thenComparing(DayKey::stage)
                .thenComparing(DayKey::modelAlias);

        @Override
        public int compareTo(DayKey other) {
            return ORDER.compare(this, other);
        }
    }

    private static CostSummary summarize(List<CostRecord> list) {
        var byStage = new TreeMap<String, Double>();
        var byModel = new TreeMap<String, Double>();
        double total = 0;
        long in = 0;
        long out = 0;
        for (CostRecord r : list) {
            total += r.cost();
            in += r.inputTokens();
            out += r.outputTokens();
            byStage.merge(r.stage().configKey(), r.cost(), Double::sum);
            byModel.merge(r.modelAlias(), r.cost(), Double::sum);
        }
        return new CostSummary(total, list.size(), in, out, byStage, byModel);
    }
}

package com.browserpilot.core.metrics;

import com.browserpilot.core.model.ErrorType;
import com.browserpilot.core.model.InterruptKind;
import com.browserpilot.core.model.Outcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for the browser agent's control loop.
 */
@Service
public class AgentMetrics {

    private final MeterRegistry registry;

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordNodeInvocation(String nodeId) {
        Counter.builder("browserpilot.node.invocations")
                .tag("node", nodeId)
                .register(registry)
                .increment();
    }

    public void recordToolError(ErrorType kind) {
        Counter.builder("browserpilot.tool.errors")
                .tag("kind", kind.wireName())
                .register(registry)
                .increment();
    }

    /**
     * Records the wall-clock duration of one tool batch.
     *
     * @param size number of actions in the batch
     * @param parallel whether the batch was dispatched concurrently
     */
    public void recordToolBatch(int size, boolean parallel, long ms) {
        String mode = parallel ? "parallel" : "sequential";
        Timer.builder("browserpilot.tool.batch.duration")
                .tag("mode", mode)
                .register(registry)
                .record(Duration.ofMillis(ms));

        DistributionSummary.builder("browserpilot.tool.batch.size")
                .tag("mode", mode)
                .register(registry)
                .record(size);
    }

    public void recordOutcome(Outcome outcome, long steps) {
        String reason = outcome.isSuccess() ? "goal_achieved" : outcome.reason();
        Counter.builder("browserpilot.tasks")
                .tag("status", outcome.status().name().toLowerCase())
                .tag("reason", reason)
                .register(registry)
                .increment();

        DistributionSummary.builder("browserpilot.task.steps")
                .description("Loop iterations per finished task")
                .register(registry)
                .record(steps);
    }

    public void recordSuspension(InterruptKind kind) {
        Counter.builder("browserpilot.suspensions")
                .tag("kind", kind.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordCompaction(int removedMessages) {
        Counter.builder("browserpilot.compactions")
                .register(registry)
                .increment();

        DistributionSummary.builder("browserpilot.compaction.removed")
                .description("Messages folded into the running summary per compaction")
                .register(registry)
                .record(removedMessages);
    }

    public void recordStrategyChange() {
        Counter.builder("browserpilot.strategy.changes")
                .register(registry)
                .increment();
    }
}

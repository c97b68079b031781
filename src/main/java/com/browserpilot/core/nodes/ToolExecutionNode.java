package com.browserpilot.core.nodes;

import com.browserpilot.core.config.AgentProperties;
import com.browserpilot.core.errors.ErrorClassifier;
import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RoutingNode;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.graph.Transition;
import com.browserpilot.core.metrics.AgentMetrics;
import com.browserpilot.core.model.ActionBatch;
import com.browserpilot.core.model.ActionRequest;
import com.browserpilot.core.model.ErrorType;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.Outcome;
import com.browserpilot.core.model.ToolResult;
import com.browserpilot.core.reflection.CorrectionAdvisor;
import com.browserpilot.core.state.StateUpdate;
import com.browserpilot.core.state.TaskState;
import com.browserpilot.core.tools.ToolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs the planned batch of browser actions and routes on how it went.
 * <p>
 * Batches marked parallel are dispatched together and joined in request order;
 * others run one after another. Every result is classified and the first failure in
 * batch order decides the route, so a later success cannot hide an earlier error.
 */
@Component
public class ToolExecutionNode implements RoutingNode {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutionNode.class);

    static final String CANCELLED_RESULT = "cancelled before completion";
    private static final long POLL_MILLIS = 100;

    private final ToolExecutor toolExecutor;
    private final ErrorClassifier classifier;
    private final CorrectionAdvisor advisor;
    private final ExecutorService dispatchPool;
    private final AgentMetrics metrics;
    private final int maxRetries;
    private final int progressCadence;
    private final int reportCadence;

    @Autowired
    public ToolExecutionNode(ToolExecutor toolExecutor, ErrorClassifier classifier, CorrectionAdvisor advisor,
                             @Qualifier("toolDispatchPool") ExecutorService dispatchPool,
                             AgentMetrics metrics, AgentProperties properties) {
        this(toolExecutor, classifier, advisor, dispatchPool, metrics,
                properties.getLoop().getMaxRetries(),
                properties.getLoop().getProgressCadence(),
                properties.getLoop().getReportCadence());
    }

    public ToolExecutionNode(ToolExecutor toolExecutor, ErrorClassifier classifier, CorrectionAdvisor advisor,
                             ExecutorService dispatchPool, AgentMetrics metrics,
                             int maxRetries, int progressCadence, int reportCadence) {
        this.toolExecutor = toolExecutor;
        this.classifier = classifier;
        this.advisor = advisor;
        this.dispatchPool = dispatchPool;
        this.metrics = metrics;
        this.maxRetries = maxRetries;
        this.progressCadence = progressCadence;
        this.reportCadence = reportCadence;
    }

    @Override
    public String id() {
        return NodeIds.TOOL_EXECUTION;
    }

    @Override
    public Transition apply(TaskState state, RunContext context) {
        ActionBatch batch = state.plannedBatch();
        if (batch.isEmpty()) {
            log.warn("Tool execution reached with no planned actions");
            return Transition.next(NodeIds.REASONING, StateUpdate.builder()
                    .resetValidation()
                    .clearPlannedBatch()
                    .build());
        }

        long start = System.currentTimeMillis();
        boolean parallel = batch.parallel() && batch.size() > 1;
        List<ToolResult> results = parallel
                ? runParallel(batch.actions(), context)
                : runSequential(batch.actions(), context);
        if (metrics != null) {
            metrics.recordToolBatch(batch.size(), parallel, System.currentTimeMillis() - start);
        }

        var update = StateUpdate.builder()
                .resetValidation()
                .clearPlannedBatch();
        for (ToolResult result : results) {
            update.appendMessage(Message.tool(result));
        }

        if (context.cancellation().isCancelled()) {
            String aborted = results.stream()
                    .filter(r -> !r.ok() && CANCELLED_RESULT.equals(r.content()))
                    .map(ToolResult::actionName)
                    .collect(Collectors.joining(", "));
            update.appendMessage(Message.feedback("Aborted (" + Outcome.CANCELLED + "): "
                    + (aborted.isEmpty() ? "batch finished before cancellation took effect" : "not completed: " + aborted)));
            log.warn("Tool batch cancelled");
            return Transition.terminal(Outcome.failure(Outcome.CANCELLED), update.build());
        }

        ToolResult firstFailure = null;
        ErrorType kind = ErrorType.NONE;
        for (ToolResult result : results) {
            ErrorType resultKind = classifier.classify(result);
            if (resultKind.isError()) {
                if (metrics != null) metrics.recordToolError(resultKind);
                if (firstFailure == null) {
                    firstFailure = result;
                    kind = resultKind;
                }
            }
        }

        if (kind == ErrorType.NONE) {
            update.errorType(ErrorType.NONE).lastError(null).errorCount(0);
            if (state.complexTask() && isCadenceStep(state.step(), progressCadence)) {
                return Transition.next(NodeIds.PROGRESS_ANALYZER, update.build());
            }
            if (isCadenceStep(state.step(), reportCadence)) {
                return Transition.next(NodeIds.PROGRESS_REPORTER, update.build());
            }
            return Transition.next(NodeIds.REASONING, update.build());
        }

        int count = state.errorCount() + 1;
        update.errorType(kind).lastError(firstFailure.content()).errorCount(count);
        if (count > maxRetries) {
            log.error("Retry bound of {} exceeded, last error ({}): {}", maxRetries, kind.wireName(), firstFailure.content());
            return Transition.terminal(Outcome.retryExhausted(kind, firstFailure.content()), update.build());
        }

        if (kind == ErrorType.STALE_REF) {
            log.warn("Stale element reference from {}, self-correction {}/{}", firstFailure.actionName(), count, maxRetries);
            return Transition.next(NodeIds.SELF_CORRECTOR, update.build());
        }

        log.warn("Action {} failed ({}), retry {}/{}", firstFailure.actionName(), kind.wireName(), count, maxRetries);
        update.appendMessage(Message.feedback("Action " + firstFailure.actionName() + " failed ("
                + kind.wireName() + "): " + firstFailure.content() + ". " + advisor.guidance(kind)));
        return Transition.next(NodeIds.REASONING, update.build());
    }

    private List<ToolResult> runSequential(List<ActionRequest> actions, RunContext context) {
        var results = new ArrayList<ToolResult>(actions.size());
        for (ActionRequest action : actions) {
            if (context.cancellation().isCancelled()) {
                results.add(ToolResult.error(CANCELLED_RESULT).forRequest(action));
            } else {
                results.add(executeSafely(action));
            }
        }
        return results;
    }

    private List<ToolResult> runParallel(List<ActionRequest> actions, RunContext context) {
        var futures = new ArrayList<CompletableFuture<ToolResult>>(actions.size());
        for (ActionRequest action : actions) {
            futures.add(CompletableFuture.supplyAsync(() -> executeSafely(action), dispatchPool));
        }

        var results = new ArrayList<ToolResult>(actions.size());
        for (int i = 0; i < actions.size(); i++) {
            results.add(await(futures.get(i), actions.get(i), context));
        }
        return results;
    }

    private ToolResult await(CompletableFuture<ToolResult> future, ActionRequest action, RunContext context) {
        while (true) {
            if (context.cancellation().isCancelled() && !future.isDone()) {
                future.cancel(true);
                return ToolResult.error(CANCELLED_RESULT).forRequest(action);
            }
            try {
                return future.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.trace("Still waiting on {}", action.name());
            } catch (CancellationException e) {
                return ToolResult.error(CANCELLED_RESULT).forRequest(action);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                return ToolResult.error(String.valueOf(cause.getMessage())).forRequest(action);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancellation().cancel();
                future.cancel(true);
                return ToolResult.error(CANCELLED_RESULT).forRequest(action);
            }
        }
    }

    private ToolResult executeSafely(ActionRequest action) {
        try {
            ToolResult result = toolExecutor.execute(action.name(), action.args());
            if (result == null) {
                return ToolResult.error("Action returned no result").forRequest(action);
            }
            return result.forRequest(action);
        } catch (RuntimeException e) {
            log.warn("Action {} threw {}: {}", action.name(), e.getClass().getSimpleName(), e.getMessage());
            String text = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ToolResult.error(text).forRequest(action);
        }
    }

    private static boolean isCadenceStep(long step, int cadence) {
        return cadence > 0 && step > 0 && step % cadence == 0;
    }
}

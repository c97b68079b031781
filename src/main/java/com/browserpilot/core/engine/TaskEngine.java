package com.browserpilot.core.engine;

import com.browserpilot.core.config.AgentProperties;
import com.browserpilot.core.events.AgentEvent;
import com.browserpilot.core.events.EventBus;
import com.browserpilot.core.graph.CancellationSignal;
import com.browserpilot.core.graph.Continuation;
import com.browserpilot.core.graph.ControlLoop;
import com.browserpilot.core.graph.LoopResult;
import com.browserpilot.core.graph.NodeIds;
import com.browserpilot.core.graph.RunContext;
import com.browserpilot.core.human.HumanInterface;
import com.browserpilot.core.logging.MdcContext;
import com.browserpilot.core.model.InteractionMode;
import com.browserpilot.core.model.Outcome;
import com.browserpilot.core.persistence.SessionRecord;
import com.browserpilot.core.persistence.TaskStateStore;
import com.browserpilot.core.policy.ActionPolicy;
import com.browserpilot.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Year;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Runs browser tasks through the control loop.
 * <p>
 * Creates the task state and session id, keeps suspended sessions in the
 * {@link TaskStateStore} until they are resumed, and publishes lifecycle events.
 * A finished session is removed from the store.
 */
@Service
public class TaskEngine {

    private static final Logger log = LoggerFactory.getLogger(TaskEngine.class);
    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger(0);

    private static final Pattern MULTI_STEP = Pattern.compile(
            "\\b(then|after that|afterwards|and also|finally|next)\\b|;|\\d+\\.\\s", Pattern.CASE_INSENSITIVE);

    private final ControlLoop loop;
    private final TaskStateStore store;
    private final EventBus eventBus;
    private final InteractionMode defaultMode;
    private final int complexTaskMinWords;

    /** Sessions with a loop in progress in this process, claimed for the length of one run. */
    private final Map<String, RunContext> activeContexts = new ConcurrentHashMap<>();

    @Autowired
    public TaskEngine(ControlLoop loop, TaskStateStore store, EventBus eventBus,
                      ActionPolicy policy, AgentProperties properties) {
        this(loop, store, eventBus, policy.defaultMode(), properties.getLoop().getComplexTaskMinWords());
    }

    public TaskEngine(ControlLoop loop, TaskStateStore store, EventBus eventBus,
                      InteractionMode defaultMode, int complexTaskMinWords) {
        this.loop = loop;
        this.store = store;
        this.eventBus = eventBus;
        this.defaultMode = defaultMode;
        this.complexTaskMinWords = complexTaskMinWords;
    }

    public TaskRun start(String task) {
        return start(task, TaskOptions.defaults());
    }

    /**
     * Starts a task and runs it until it finishes or needs the user.
     */
    public TaskRun start(String task, TaskOptions options) {
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("Task must not be blank");
        }
        String sessionId = generateSessionId();
        boolean complex = options.complex() != null ? options.complex() : isComplex(task, complexTaskMinWords);
        InteractionMode mode = options.mode() != null ? options.mode() : defaultMode;
        var state = new TaskState(sessionId, task.trim(), complex, mode);
        var context = claim(new RunContext(sessionId, new CancellationSignal(), options.maxSteps()));

        MdcContext.setSession(sessionId);
        try {
            log.info("Starting session {} (complex={}, mode={}): {}", sessionId, complex, mode, task);
            var payload = new LinkedHashMap<String, Object>();
            payload.put("task", task);
            payload.put("complex", complex);
            payload.put("mode", mode.name());
            eventBus.publish(AgentEvent.of(AgentEvent.TASK_STARTED, sessionId, null, payload));

            LoopResult result = loop.run(state, NodeIds.REASONING, context);
            return settle(state, result);
        } finally {
            release(context);
            MdcContext.clear();
        }
    }

    /**
     * Continues a suspended session with the user's answer.
     *
     * @throws SessionNotFoundException if the session is not suspended
     */
    public TaskRun resume(String sessionId, String response) {
        return resume(sessionId, response, 0);
    }

    private TaskRun resume(String sessionId, String response, int stepLimit) {
        RunContext context = claim(new RunContext(sessionId, new CancellationSignal(), stepLimit));
        MdcContext.setSession(sessionId);
        try {
            SessionRecord record = store.load(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            TaskState state = TaskState.restore(record.state());
            eventBus.publish(AgentEvent.of(AgentEvent.TASK_RESUMED, sessionId, record.continuation().resumeNode(),
                    Map.of("response", response != null ? response : "")));
            LoopResult result = loop.resume(state, record.continuation(), response, context);
            return settle(state, result);
        } finally {
            release(context);
            MdcContext.clear();
        }
    }

    /**
     * Runs a task to completion, asking {@code human} whenever the loop suspends.
     */
    public TaskRun runInteractive(String task, TaskOptions options, HumanInterface human) {
        TaskRun run = start(task, options);
        while (run.isSuspended()) {
            Continuation continuation = run.continuation().orElseThrow();
            String answer = human.ask(continuation.interrupt().message(), continuation.interrupt().options());
            run = resume(run.sessionId(), answer, options.maxSteps());
        }
        return run;
    }

    /**
     * Requests cancellation. A running loop stops at its next iteration boundary; a
     * suspended session is failed immediately.
     *
     * @return false if the session is neither running in this process nor stored
     */
    public boolean cancel(String sessionId) {
        var cancelled = new CancellationSignal();
        cancelled.cancel();
        var context = new RunContext(sessionId, cancelled, 0);
        RunContext running = activeContexts.putIfAbsent(sessionId, context);
        if (running != null) {
            log.info("Cancelling running session {}", sessionId);
            running.cancellation().cancel();
            return true;
        }

        MdcContext.setSession(sessionId);
        try {
            var record = store.load(sessionId);
            if (record.isEmpty()) {
                return false;
            }
            log.info("Cancelling suspended session {}", sessionId);
            TaskState state = TaskState.restore(record.get().state());
            settle(state, loop.run(state, record.get().continuation().resumeNode(), context));
            return true;
        } finally {
            release(context);
            MdcContext.clear();
        }
    }

    public List<String> suspendedSessions() {
        return store.listSessionIds();
    }

    private TaskRun settle(TaskState state, LoopResult result) {
        String sessionId = state.sessionId();
        if (result instanceof LoopResult.Suspended suspended) {
            Continuation continuation = suspended.continuation();
            store.save(sessionId, new SessionRecord(state.snapshot(), continuation));
            var payload = new LinkedHashMap<String, Object>();
            payload.put("kind", continuation.interrupt().kind().name());
            payload.put("message", continuation.interrupt().message());
            payload.put("options", continuation.interrupt().options());
            eventBus.publish(AgentEvent.of(AgentEvent.TASK_SUSPENDED, sessionId, continuation.resumeNode(), payload));
            return new TaskRun(sessionId, result, state);
        }

        Outcome outcome = ((LoopResult.Finished) result).outcome();
        store.delete(sessionId);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("reason", outcome.reason());
        payload.put("steps", state.step());
        if (outcome.detail() != null) {
            payload.put("detail", outcome.detail());
        }
        eventBus.publish(AgentEvent.of(outcome.isSuccess() ? AgentEvent.TASK_COMPLETED : AgentEvent.TASK_FAILED,
                sessionId, null, payload));
        return new TaskRun(sessionId, result, state);
    }

    private RunContext claim(RunContext context) {
        RunContext running = activeContexts.putIfAbsent(context.sessionId(), context);
        if (running != null) {
            throw new IllegalStateException("Session " + context.sessionId() + " is already running");
        }
        return context;
    }

    private void release(RunContext context) {
        activeContexts.remove(context.sessionId(), context);
    }

    private String generateSessionId() {
        String id;
        do {
            id = String.format("BP-%d-%04d", Year.now().getValue(), SESSION_COUNTER.incrementAndGet());
        } while (store.load(id).isPresent());
        return id;
    }

    /**
     * Long tasks, and tasks phrased as a sequence of steps, get periodic progress analysis.
     */
    static boolean isComplex(String task, int minWords) {
        String trimmed = task.trim();
        if (trimmed.isEmpty()) return false;
        int words = trimmed.toLowerCase(Locale.ROOT).split("\\s+").length;
        return words >= minWords || MULTI_STEP.matcher(trimmed).find();
    }
}

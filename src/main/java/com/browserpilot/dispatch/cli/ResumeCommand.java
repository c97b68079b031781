package com.browserpilot.dispatch.cli;

import com.browserpilot.core.engine.SessionNotFoundException;
import com.browserpilot.core.engine.TaskEngine;
import com.browserpilot.core.events.AgentEvent;
import com.browserpilot.core.events.EventBus;
import com.browserpilot.core.events.EventFilter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: browser-pilot resume &lt;sessionId&gt; &lt;answer&gt;
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Answer a suspended session")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session id, e.g. BP-2026-0001")
    String sessionId;

    @Parameters(index = "1", description = "Answer to the pending question")
    String answer;

    private final TaskEngine engine;
    private final EventBus eventBus;

    public ResumeCommand(TaskEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        var filter = EventFilter.types(AgentEvent.PROGRESS).forSession(sessionId);
        try (var progress = eventBus.subscribe(filter, ConsoleOutput::progress)) {
            return ConsoleOutput.runResult(engine.resume(sessionId, answer));
        } catch (SessionNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Resume failed: " + RunCommand.rootCauseMessage(e));
            return 2;
        }
    }
}

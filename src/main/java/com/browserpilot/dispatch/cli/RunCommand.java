package com.browserpilot.dispatch.cli;

import com.browserpilot.core.engine.TaskEngine;
import com.browserpilot.core.engine.TaskOptions;
import com.browserpilot.core.engine.TaskRun;
import com.browserpilot.core.events.AgentEvent;
import com.browserpilot.core.events.EventBus;
import com.browserpilot.core.events.EventFilter;
import com.browserpilot.core.human.HumanInterface;
import com.browserpilot.core.model.InteractionMode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: browser-pilot run "&lt;task&gt;"
 * <p>
 * Runs a browser task. Questions from the agent are asked on the console unless
 * {@code --detach} is given, in which case the session is left suspended.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a browser task")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language task")
    String task;

    @Option(names = "--complex", description = "Force periodic progress analysis")
    boolean complex;

    @Option(names = "--full-auto", description = "Execute critical actions without confirmation")
    boolean fullAuto;

    @Option(names = "--max-steps", description = "Iteration ceiling for this task", defaultValue = "0")
    int maxSteps;

    @Option(names = "--detach", description = "Stop at the first question and print the session id")
    boolean detach;

    @Option(names = {"-v", "--verbose"}, description = "Debug logging")
    boolean verbose;

    private final TaskEngine engine;
    private final HumanInterface human;
    private final EventBus eventBus;

    public RunCommand(TaskEngine engine, HumanInterface human, EventBus eventBus) {
        this.engine = engine;
        this.human = human;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (verbose) {
            ConsoleOutput.enableVerboseLogging();
        }
        var options = new TaskOptions(complex ? Boolean.TRUE : null,
                fullAuto ? InteractionMode.FULL_AUTO : null, maxSteps);
        ConsoleOutput.info("Task: " + task);

        TaskRun run;
        // the session id is assigned inside start, so listen to every session
        try (var progress = eventBus.subscribe(EventFilter.types(AgentEvent.PROGRESS), ConsoleOutput::progress)) {
            run = detach ? engine.start(task, options) : engine.runInteractive(task, options, human);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Task failed: " + rootCauseMessage(e));
            return 2;
        }
        return ConsoleOutput.runResult(run);
    }

    static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

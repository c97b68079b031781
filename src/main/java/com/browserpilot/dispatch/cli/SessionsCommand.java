package com.browserpilot.dispatch.cli;

import com.browserpilot.core.engine.TaskEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: browser-pilot sessions
 */
@Command(name = "sessions", mixinStandardHelpOptions = true, description = "List suspended sessions")
@Component
public class SessionsCommand implements Runnable {

    private final TaskEngine engine;

    public SessionsCommand(TaskEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        var ids = engine.suspendedSessions();
        if (ids.isEmpty()) {
            ConsoleOutput.info("No suspended sessions.");
            return;
        }
        ids.forEach(System.out::println);
    }
}

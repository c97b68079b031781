package com.browserpilot.dispatch.cli;

import com.browserpilot.core.engine.TaskRun;
import com.browserpilot.core.events.AgentEvent;
import com.browserpilot.core.model.Interrupt;
import com.browserpilot.core.model.Outcome;
import ch.qos.logback.classic.Level;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;

/**
 * ANSI-colored terminal output for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) BROWSER PILOT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PILOT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void question(Interrupt interrupt) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [" + interrupt.kind() + "]|@ " + interrupt.message()));
        List<String> options = interrupt.options();
        for (int i = 0; i < options.size(); i++) {
            System.out.println("  " + (i + 1) + ". " + options.get(i));
        }
    }

    /**
     * Prints a progress report as {@code [status] NN% - N exchanges, N errors}.
     * Reports taken before any exchange are skipped.
     */
    public static void progress(AgentEvent event) {
        Map<String, Object> payload = event.payload();
        int messages = intValue(payload.get("messages"));
        if (messages == 0) {
            return;
        }
        double score = payload.get("progressScore") instanceof Number n ? n.doubleValue() : 0.0;
        String status = String.valueOf(payload.getOrDefault("status", "Working"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|faint [" + status + "] " + (int) (score * 100) + "% - " + messages + " exchanges, "
                        + intValue(payload.get("errorCount")) + " errors|@"));
    }

    public static void action(String name, boolean critical, String description) {
        String marker = critical ? "@|fg(red),bold !|@" : " ";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                marker + " @|fg(blue) " + name + "|@" + (description != null && !description.isBlank()
                        ? "  " + description : "")));
    }

    /**
     * Prints the final outcome, or the pending question when the run is suspended.
     *
     * @return process exit code for the run
     */
    public static int runResult(TaskRun run) {
        if (run.isSuspended()) {
            var continuation = run.continuation().orElseThrow();
            question(continuation.interrupt());
            info("Session " + run.sessionId() + " is waiting. Answer with: browser-pilot resume "
                    + run.sessionId() + " <answer>");
            return 0;
        }
        Outcome outcome = run.outcome().orElseThrow();
        System.out.println("──────────────────────────────────");
        if (outcome.isSuccess()) {
            success("Task completed in " + run.state().step() + " steps");
            if (outcome.reason() != null && !outcome.reason().isBlank()) {
                System.out.println("  " + outcome.reason());
            }
            return 0;
        }
        error("Task failed after " + run.state().step() + " steps: " + outcome.reason());
        if (outcome.detail() != null) {
            System.out.println("  " + outcome.detail());
        }
        return 1;
    }

    private static int intValue(Object value) {
        return value instanceof Number n ? n.intValue() : 0;
    }

    /**
     * Raises the application log level for {@code --verbose}.
     */
    public static void enableVerboseLogging() {
        var logger = LoggerFactory.getLogger("com.browserpilot");
        if (logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }
}

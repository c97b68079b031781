package com.browserpilot.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: run, resume, sessions, actions.
 */
@Command(
        name = "browser-pilot",
        mixinStandardHelpOptions = true,
        version = "BrowserPilot 0.1.0",
        description = "Autonomous browser agent driven by an explicit routing loop",
        subcommands = {
                RunCommand.class,
                ResumeCommand.class,
                SessionsCommand.class,
                ActionsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BrowserPilotCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}

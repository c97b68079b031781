package com.browserpilot.dispatch.cli;

import com.browserpilot.core.policy.ActionPolicy;
import com.browserpilot.core.tools.ToolExecutor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: browser-pilot actions
 * <p>
 * Lists the browser actions the tool server offers. Critical actions are marked with {@code !}.
 */
@Command(name = "actions", mixinStandardHelpOptions = true, description = "List available browser actions")
@Component
public class ActionsCommand implements Runnable {

    private final ToolExecutor toolExecutor;
    private final ActionPolicy policy;

    public ActionsCommand(ToolExecutor toolExecutor, ActionPolicy policy) {
        this.toolExecutor = toolExecutor;
        this.policy = policy;
    }

    @Override
    public void run() {
        var actions = toolExecutor.availableActions();
        if (actions.isEmpty()) {
            ConsoleOutput.error("No actions available. Is browserpilot.mcp configured?");
            return;
        }
        for (var action : actions) {
            ConsoleOutput.action(action.name(), policy.isCritical(action.name()), action.description());
        }
    }
}

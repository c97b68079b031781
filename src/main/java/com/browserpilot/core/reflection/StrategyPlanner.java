package com.browserpilot.core.reflection;

import com.browserpilot.core.model.Message;
import com.browserpilot.core.state.TaskState;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Proposes a different approach when progress has stalled. Strategies rotate with
 * each adaptation so repeated stalls do not get the same advice.
 */
@Component
public class StrategyPlanner {

    static final List<String> STRATEGIES = List.of(
            "Re-inspect the current page and target elements by their visible text instead of earlier references.",
            "Navigate directly to the target URL, or use the site's search, instead of clicking through menus.",
            "Split the task and finish one smaller sub-goal before returning to the rest.",
            "Check whether a dialog, cookie banner or login wall is covering the page and deal with it first.");

    private static final int FAILURE_WINDOW = 10;

    public String propose(TaskState state) {
        String strategy = STRATEGIES.get(state.strategyChanges() % STRATEGIES.size());

        List<Message> history = state.history();
        var failing = new LinkedHashSet<String>();
        for (Message m : history.subList(Math.max(0, history.size() - FAILURE_WINDOW), history.size())) {
            if (m.isFailedToolResult() && m.actionName() != null) {
                failing.add(m.actionName());
            }
        }

        var sb = new StringBuilder("Progress has stalled (score ")
                .append(String.format("%.2f", state.progressScore()))
                .append("). Change approach. ");
        if (!failing.isEmpty()) {
            sb.append("Stop repeating: ").append(String.join(", ", failing)).append(". ");
        }
        return sb.append("Try this: ").append(strategy).toString();
    }
}

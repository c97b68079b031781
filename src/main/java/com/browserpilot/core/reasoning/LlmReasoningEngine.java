package com.browserpilot.core.reasoning;

import com.browserpilot.core.llm.LlmService;
import com.browserpilot.core.llm.Transcripts;
import com.browserpilot.core.model.ActionRequest;
import com.browserpilot.core.model.ActionSpec;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.MessageRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Reasoning backed by a chat model through {@link LlmService}.
 * <p>
 * System messages and the action catalog form the system prompt; the rest of the
 * history is rendered as a transcript.
 */
@Service
public class LlmReasoningEngine implements ReasoningEngine {

    private static final Logger log = LoggerFactory.getLogger(LlmReasoningEngine.class);

    private final LlmService llmService;

    public LlmReasoningEngine(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public ReasoningResult infer(List<Message> history, List<ActionSpec> availableActions) {
        var system = new StringBuilder();
        var conversation = new ArrayList<Message>();
        for (Message message : history) {
            if (message.role() == MessageRole.SYSTEM) {
                system.append(message.content()).append('\n');
            } else {
                conversation.add(message);
            }
        }
        system.append("\nAvailable actions:\n");
        for (ActionSpec spec : availableActions) {
            system.append("- ").append(spec.name());
            if (spec.description() != null && !spec.description().isBlank()) {
                system.append(": ").append(spec.description());
            }
            if (spec.inputSchema() != null) {
                system.append(" args=").append(spec.inputSchema());
            }
            system.append('\n');
        }

        ReasoningDecision decision = llmService.structuredCall(
                system.toString(), Transcripts.render(conversation), ReasoningDecision.class);
        return toResult(decision);
    }

    static ReasoningResult toResult(ReasoningDecision decision) {
        List<ReasoningDecision.Call> calls = decision.actions() != null ? decision.actions() : List.of();
        if (Boolean.TRUE.equals(decision.taskComplete()) || calls.isEmpty()) {
            String answer = decision.finalAnswer() != null && !decision.finalAnswer().isBlank()
                    ? decision.finalAnswer()
                    : decision.thought();
            return new ReasoningResult.Completion(answer);
        }
        var requests = calls.stream()
                .filter(c -> c.name() != null && !c.name().isBlank())
                .map(c -> ActionRequest.of(c.name(), c.arguments()))
                .toList();
        log.debug("Model requested {} action(s): {}", requests.size(),
                requests.stream().map(ActionRequest::name).toList());
        return new ReasoningResult.ActionPlan(decision.thought(), requests, Boolean.TRUE.equals(decision.parallel()));
    }
}

package com.browserpilot.core.memory;

import com.browserpilot.core.model.ActionRequest;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.ToolResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExtractiveSummarizerTest {

    private final TokenEstimator estimator = new TokenEstimator();
    private final ExtractiveSummarizer summarizer = new ExtractiveSummarizer(estimator);

    @Test
    @DisplayName("one line per message, system prompts skipped")
    void linePerMessage() {
        var request = ActionRequest.of("navigate", Map.of("url", "https://example.com"));
        var messages = List.of(
                Message.system("guidance"),
                Message.user("get the title"),
                Message.assistant("go", List.of(request)),
                Message.tool(ToolResult.ok("Example Domain").forRequest(request)),
                Message.feedback("retry later"));

        String summary = summarizer.summarize(null, messages, 500);

        assertEquals(String.join("\n",
                ExtractiveSummarizer.HEADER,
                "- user: get the title",
                "- requested: navigate(url=https://example.com)",
                "- navigate ok: Example Domain",
                "- note: retry later"), summary);
    }

    @Test
    @DisplayName("extends the previous summary")
    void extendsPrevious() {
        String first = summarizer.summarize(null, List.of(Message.user("first")), 500);

        String second = summarizer.summarize(first, List.of(Message.user("second")), 500);

        assertEquals(ExtractiveSummarizer.HEADER + "\n- user: first\n- user: second", second);
    }

    @Test
    @DisplayName("drops the oldest lines to stay within budget")
    void staysWithinBudget() {
        var messages = new ArrayList<Message>();
        for (int i = 0; i < 50; i++) {
            messages.add(Message.user("message number " + i + " with some padding text"));
        }

        String summary = summarizer.summarize(null, messages, 60);

        assertTrue(estimator.estimate(summary) <= 60);
        assertTrue(summary.contains("message number 49"));
        assertFalse(summary.contains("message number 0 "));
    }

    @Test
    @DisplayName("failed tool results are marked as failed")
    void marksFailures() {
        var request = ActionRequest.of("click", Map.of());
        String summary = summarizer.summarize(null,
                List.of(Message.tool(ToolResult.error("no such element").forRequest(request))), 500);

        assertTrue(summary.contains("- click failed: Error: no such element"));
    }
}

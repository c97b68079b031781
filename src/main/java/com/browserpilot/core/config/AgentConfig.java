package com.browserpilot.core.config;

import com.browserpilot.core.llm.LlmService;
import com.browserpilot.core.memory.ExtractiveSummarizer;
import com.browserpilot.core.memory.HistoryCompactor;
import com.browserpilot.core.memory.LlmSummarizer;
import com.browserpilot.core.memory.Summarizer;
import com.browserpilot.core.memory.TokenEstimator;
import com.browserpilot.core.policy.ActionPolicy;
import com.browserpilot.core.reflection.CompletionJudge;
import com.browserpilot.core.reflection.HeuristicCompletionJudge;
import com.browserpilot.core.reflection.LlmCompletionJudge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the collaborators whose implementation depends on configuration.
 */
@Configuration
public class AgentConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentConfig.class);

    @Bean
    public Summarizer summarizer(AgentProperties properties, TokenEstimator estimator, LlmService llmService) {
        if ("llm".equalsIgnoreCase(properties.getMemory().getSummarizer())) {
            log.info("Using LLM running summaries");
            return new LlmSummarizer(llmService, estimator);
        }
        return new ExtractiveSummarizer(estimator);
    }

    @Bean
    public HistoryCompactor historyCompactor(AgentProperties properties, TokenEstimator estimator,
                                             Summarizer summarizer) {
        var memory = properties.getMemory();
        return new HistoryCompactor(estimator, summarizer,
                memory.getPreThresholdTokens(), memory.getHardLimitTokens(),
                memory.getMaxSummaryTokens(), memory.getKeepRecentMessages());
    }

    @Bean
    public CompletionJudge completionJudge(AgentProperties properties, ActionPolicy policy, LlmService llmService) {
        var heuristic = new HeuristicCompletionJudge(policy);
        if ("llm".equalsIgnoreCase(properties.getReflection().getJudge())) {
            log.info("Using LLM completion judge");
            return new LlmCompletionJudge(llmService, heuristic);
        }
        return heuristic;
    }

    @Bean(name = "toolDispatchPool", destroyMethod = "shutdownNow")
    public ExecutorService toolDispatchPool(AgentProperties properties) {
        int threads = Math.max(1, properties.getLoop().getToolParallelism());
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "tool-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}

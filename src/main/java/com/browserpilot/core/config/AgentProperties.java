package com.browserpilot.core.config;

import com.browserpilot.core.model.InteractionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the control loop and its routing nodes.
 *
 * <pre>
 * browserpilot:
 *   loop:
 *     max-steps: 150
 *     max-retries: 3
 *   policy:
 *     interaction-mode: CONFIRM_CRITICAL
 *   memory:
 *     pre-threshold-tokens: 16000
 *     hard-limit-tokens: 20000
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "browserpilot")
public class AgentProperties {

    private Loop loop = new Loop();
    private Policy policy = new Policy();
    private Memory memory = new Memory();
    private Reflection reflection = new Reflection();
    private Persistence persistence = new Persistence();

    public Loop getLoop() { return loop; }
    public void setLoop(Loop loop) { this.loop = loop; }
    public Policy getPolicy() { return policy; }
    public void setPolicy(Policy policy) { this.policy = policy; }
    public Memory getMemory() { return memory; }
    public void setMemory(Memory memory) { this.memory = memory; }
    public Reflection getReflection() { return reflection; }
    public void setReflection(Reflection reflection) { this.reflection = reflection; }
    public Persistence getPersistence() { return persistence; }
    public void setPersistence(Persistence persistence) { this.persistence = persistence; }

    public static class Loop {
        private int maxSteps = 150;
        private int maxRetries = 3;
        private int progressCadence = 5;
        private int reportCadence = 3;
        private int complexTaskMinWords = 12;
        private int minimalGuidanceAfterStep = 25;
        private int toolParallelism = 4;

        public int getMaxSteps() { return maxSteps; }
        public void setMaxSteps(int maxSteps) { this.maxSteps = maxSteps; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public int getProgressCadence() { return progressCadence; }
        public void setProgressCadence(int progressCadence) { this.progressCadence = progressCadence; }
        public int getReportCadence() { return reportCadence; }
        public void setReportCadence(int reportCadence) { this.reportCadence = reportCadence; }
        public int getComplexTaskMinWords() { return complexTaskMinWords; }
        public void setComplexTaskMinWords(int complexTaskMinWords) { this.complexTaskMinWords = complexTaskMinWords; }
        public int getMinimalGuidanceAfterStep() { return minimalGuidanceAfterStep; }
        public void setMinimalGuidanceAfterStep(int minimalGuidanceAfterStep) { this.minimalGuidanceAfterStep = minimalGuidanceAfterStep; }
        public int getToolParallelism() { return toolParallelism; }
        public void setToolParallelism(int toolParallelism) { this.toolParallelism = toolParallelism; }
    }

    public static class Policy {
        private List<String> criticalActions = new ArrayList<>(List.of(
                "delete_element", "submit_form", "confirm_payment",
                "delete_message", "remove_item", "cancel_order"));
        private String userQuestionAction = "request_user_confirmation";
        private InteractionMode interactionMode = InteractionMode.CONFIRM_CRITICAL;
        private List<String> mutatingActionFragments = new ArrayList<>(List.of(
                "click", "fill", "type", "press", "select", "check", "submit",
                "delete", "remove", "cancel", "confirm", "upload", "send"));

        public List<String> getCriticalActions() { return criticalActions; }
        public void setCriticalActions(List<String> criticalActions) { this.criticalActions = criticalActions; }
        public String getUserQuestionAction() { return userQuestionAction; }
        public void setUserQuestionAction(String userQuestionAction) { this.userQuestionAction = userQuestionAction; }
        public InteractionMode getInteractionMode() { return interactionMode; }
        public void setInteractionMode(InteractionMode interactionMode) { this.interactionMode = interactionMode; }
        public List<String> getMutatingActionFragments() { return mutatingActionFragments; }
        public void setMutatingActionFragments(List<String> mutatingActionFragments) { this.mutatingActionFragments = mutatingActionFragments; }
    }

    public static class Memory {
        private int preThresholdTokens = 16000;
        private int hardLimitTokens = 20000;
        private int maxSummaryTokens = 1200;
        private int keepRecentMessages = 12;
        /** "extractive" or "llm". */
        private String summarizer = "extractive";

        public int getPreThresholdTokens() { return preThresholdTokens; }
        public void setPreThresholdTokens(int preThresholdTokens) { this.preThresholdTokens = preThresholdTokens; }
        public int getHardLimitTokens() { return hardLimitTokens; }
        public void setHardLimitTokens(int hardLimitTokens) { this.hardLimitTokens = hardLimitTokens; }
        public int getMaxSummaryTokens() { return maxSummaryTokens; }
        public void setMaxSummaryTokens(int maxSummaryTokens) { this.maxSummaryTokens = maxSummaryTokens; }
        public int getKeepRecentMessages() { return keepRecentMessages; }
        public void setKeepRecentMessages(int keepRecentMessages) { this.keepRecentMessages = keepRecentMessages; }
        public String getSummarizer() { return summarizer; }
        public void setSummarizer(String summarizer) { this.summarizer = summarizer; }
    }

    public static class Reflection {
        private double stuckScoreThreshold = 0.3;
        private int stuckBound = 2;
        private double minQualityScore = 0.7;
        /** "heuristic" or "llm". */
        private String judge = "heuristic";

        public double getStuckScoreThreshold() { return stuckScoreThreshold; }
        public void setStuckScoreThreshold(double stuckScoreThreshold) { this.stuckScoreThreshold = stuckScoreThreshold; }
        public int getStuckBound() { return stuckBound; }
        public void setStuckBound(int stuckBound) { this.stuckBound = stuckBound; }
        public double getMinQualityScore() { return minQualityScore; }
        public void setMinQualityScore(double minQualityScore) { this.minQualityScore = minQualityScore; }
        public String getJudge() { return judge; }
        public void setJudge(String judge) { this.judge = judge; }
    }

    public static class Persistence {
        private String jdbcUrl = "";
        private String username = "";
        private String password = "";

        public String getJdbcUrl() { return jdbcUrl; }
        public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public boolean isJdbcConfigured() {
            return jdbcUrl != null && !jdbcUrl.isBlank();
        }
    }
}

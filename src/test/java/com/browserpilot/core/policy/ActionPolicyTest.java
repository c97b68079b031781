package com.browserpilot.core.policy;

import com.browserpilot.core.config.AgentProperties;
import com.browserpilot.core.model.ActionRequest;
import com.browserpilot.core.model.InteractionMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionPolicyTest {

    private final ActionPolicy policy = new ActionPolicy(new AgentProperties());

    @Nested
    @DisplayName("critical actions")
    class Critical {

        @Test
        @DisplayName("default critical set contains the irreversible actions")
        void defaultSet() {
            assertTrue(policy.isCritical("submit_form"));
            assertTrue(policy.isCritical("confirm_payment"));
            assertTrue(policy.isCritical("delete_element"));
            assertFalse(policy.isCritical("navigate"));
            assertFalse(policy.isCritical(null));
        }

        @Test
        @DisplayName("lookup ignores case")
        void ignoresCase() {
            assertTrue(policy.isCritical("Submit_Form"));
        }

        @Test
        @DisplayName("critical actions need approval unless the task is full-auto")
        void approvalByMode() {
            assertTrue(policy.requiresHumanApproval("submit_form", InteractionMode.CONFIRM_CRITICAL));
            assertFalse(policy.requiresHumanApproval("submit_form", InteractionMode.FULL_AUTO));
            assertFalse(policy.requiresHumanApproval("navigate", InteractionMode.CONFIRM_CRITICAL));
        }
    }

    @Nested
    @DisplayName("user questions")
    class Questions {

        @Test
        @DisplayName("the ask-user action always needs the user")
        void alwaysAsks() {
            assertTrue(policy.isUserQuestion("request_user_confirmation"));
            assertTrue(policy.requiresValidation("request_user_confirmation"));
            assertTrue(policy.requiresHumanApproval("request_user_confirmation", InteractionMode.FULL_AUTO));
        }
    }

    @Test
    @DisplayName("first action needing validation is found in batch order")
    void firstRequiringValidation() {
        var actions = List.of(
                ActionRequest.of("fill", Map.of("ref", "e1", "text", "x")),
                ActionRequest.of("submit_form", Map.of("ref", "e2")),
                ActionRequest.of("confirm_payment", Map.of()));

        assertEquals("submit_form", policy.firstRequiringValidation(actions).orElseThrow().name());
        assertTrue(policy.firstRequiringValidation(List.of(ActionRequest.of("navigate", Map.of()))).isEmpty());
    }

    @Test
    @DisplayName("mutating actions are recognised by name fragment")
    void mutating() {
        assertTrue(policy.isMutating("browser_click"));
        assertTrue(policy.isMutating("fill_form"));
        assertTrue(policy.isMutating("submit_form"));
        assertFalse(policy.isMutating("browser_snapshot"));
        assertFalse(policy.isMutating("extract_title"));
    }

    @Test
    @DisplayName("custom configuration replaces the defaults")
    void customConfiguration() {
        var custom = new ActionPolicy(List.of("purchase"), "ask_user", InteractionMode.FULL_AUTO, List.of("tap"));

        assertTrue(custom.isCritical("purchase"));
        assertFalse(custom.isCritical("submit_form"));
        assertTrue(custom.isUserQuestion("ask_user"));
        assertTrue(custom.isMutating("tap_button"));
        assertEquals(InteractionMode.FULL_AUTO, custom.defaultMode());
    }
}

package com.browserpilot.core.errors;

import com.browserpilot.core.model.ErrorType;
import com.browserpilot.core.model.ToolResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Nested
    @DisplayName("text patterns")
    class TextPatterns {

        @ParameterizedTest(name = "\"{0}\" -> {1}")
        @CsvSource(delimiter = '|', value = {
                "Blocked by reCAPTCHA challenge | CAPTCHA",
                "HTTP 429 Too Many Requests | RATE_LIMIT",
                "403 Forbidden | AUTH",
                "Login required to view this page | AUTH",
                "Ref e12 not found; ref not found in snapshot | STALE_REF",
                "Element is not attached to the DOM | STALE_REF",
                "No such element: #submit | ELEMENT_NOT_FOUND",
                "Could not find button 'Next' | ELEMENT_NOT_FOUND",
                "net::ERR_NAME_NOT_RESOLVED | NETWORK",
                "Navigation timed out after 30000ms | NETWORK",
                "CDP connection closed | NETWORK",
                "Something odd happened | UNKNOWN"
        })
        void classifiesText(String text, ErrorType expected) {
            assertEquals(expected, classifier.classifyText(text));
        }

        @Test
        @DisplayName("matching is case-insensitive")
        void caseInsensitive() {
            assertEquals(ErrorType.CAPTCHA, classifier.classifyText("HCAPTCHA shown"));
        }

        @Test
        @DisplayName("earlier kinds win when several patterns match")
        void precedence() {
            assertEquals(ErrorType.RATE_LIMIT, classifier.classifyText("429 after request timeout"));
            assertEquals(ErrorType.CAPTCHA, classifier.classifyText("captcha: unauthorized"));
            assertEquals(ErrorType.STALE_REF, classifier.classifyText("stale element, selector outdated"));
        }

        @Test
        @DisplayName("blank text is unknown")
        void blankIsUnknown() {
            assertEquals(ErrorType.UNKNOWN, classifier.classifyText(""));
            assertEquals(ErrorType.UNKNOWN, classifier.classifyText(null));
        }
    }

    @Nested
    @DisplayName("tool results")
    class Results {

        @Test
        @DisplayName("successful results are none, whatever their text")
        void okIsNone() {
            assertEquals(ErrorType.NONE, classifier.classify(ToolResult.ok("page mentions captcha")));
        }

        @Test
        @DisplayName("structured kind takes precedence over text")
        void structuredKindWins() {
            var result = ToolResult.error("request timed out", ErrorType.AUTH);

            assertEquals(ErrorType.AUTH, classifier.classify(result));
        }

        @Test
        @DisplayName("a structured none falls back to text")
        void structuredNoneFallsBack() {
            var result = ToolResult.error("request timed out", ErrorType.NONE);

            assertEquals(ErrorType.NETWORK, classifier.classify(result));
        }
    }
}

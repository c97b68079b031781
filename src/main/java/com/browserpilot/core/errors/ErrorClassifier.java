package com.browserpilot.core.errors;

import com.browserpilot.core.model.ErrorType;
import com.browserpilot.core.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps browser-action failures to an {@link ErrorType}.
 * <p>
 * A structured kind reported by the tool server wins. Otherwise the failure text is
 * matched against known phrases, in a fixed order: captcha and rate limiting are
 * checked before auth and network so that a "429 ... timeout" reads as rate limiting.
 * Text that matches nothing is {@link ErrorType#UNKNOWN}.
 */
@Component
public class ErrorClassifier {

    private static final Map<ErrorType, List<String>> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(ErrorType.CAPTCHA, List.of("captcha", "recaptcha", "hcaptcha"));
        PATTERNS.put(ErrorType.RATE_LIMIT, List.of("rate limit", "ratelimit", "429", "too many requests"));
        PATTERNS.put(ErrorType.AUTH, List.of("401", "403", "unauthorized", "forbidden",
                "login required", "not logged in", "authentication"));
        PATTERNS.put(ErrorType.STALE_REF, List.of("ref not found", "stale", "not attached", "detached"));
        PATTERNS.put(ErrorType.ELEMENT_NOT_FOUND, List.of("element not found", "no such element",
                "no element", "could not find", "selector"));
        PATTERNS.put(ErrorType.NETWORK, List.of("net::err", "connection refused", "connection reset",
                "timeout", "timed out", "dns", "cdp connection", "econn"));
    }

    public ErrorType classify(ToolResult result) {
        if (result.ok()) {
            return ErrorType.NONE;
        }
        if (result.errorKind() != null && result.errorKind().isError()) {
            return result.errorKind();
        }
        return classifyText(result.content());
    }

    public ErrorType classifyText(String text) {
        if (text == null || text.isBlank()) {
            return ErrorType.UNKNOWN;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (var entry : PATTERNS.entrySet()) {
            for (String pattern : entry.getValue()) {
                if (lower.contains(pattern)) {
                    return entry.getKey();
                }
            }
        }
        return ErrorType.UNKNOWN;
    }
}

package com.browserpilot.core.reflection;

import com.browserpilot.core.model.ErrorType;
import org.springframework.stereotype.Component;

/**
 * Recovery advice per failure kind, phrased as instructions for the next reasoning step.
 */
@Component
public class CorrectionAdvisor {

    public String guidance(ErrorType kind) {
        return switch (kind) {
            case STALE_REF -> "The element reference is stale because the page changed after it was read. "
                    + "Inspect the page again to get fresh element references, then retry the same action.";
            case ELEMENT_NOT_FOUND -> "The element could not be found. Inspect the page, check the selector or "
                    + "visible text, and scroll if the element may be outside the viewport.";
            case NETWORK -> "The browser hit a network problem. Wait briefly, then retry or reload the page.";
            case AUTH -> "The page requires authentication. Check whether the session is logged in; "
                    + "ask the user if credentials are needed.";
            case RATE_LIMIT -> "The site is rate limiting requests. Slow down and avoid repeating the same request.";
            case CAPTCHA -> "A captcha is blocking the page. Ask the user to solve it before continuing.";
            case UNKNOWN -> "The action failed for an unrecognized reason. Read the error text and try a different approach.";
            case NONE -> "";
        };
    }
}

package com.celia.orchestrator.resilience;

import com.celia.orchestrator.model.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a failed call is worth another attempt.
 *
 * Non-retryable: errors typed FATAL, validation errors, and any error whose
 * message (anywhere in the cause chain) reads like an authentication failure,
 * an unknown model or a content-policy rejection. Everything else is transient.
 *
 * An error typed TRANSIENT from an HTTP status (408, 429, 5xx) stays transient
 * whatever its body says; the status is a stronger signal than the wording.
 */
public class ErrorClassifier {

    public enum Category { AUTHENTICATION, INVALID_MODEL, CONTENT_POLICY, VALIDATION, FATAL, TRANSIENT }

    private static final Pattern AUTHENTICATION = Pattern.compile(
            "invalid[ _-]?api[ _-]?key|api key not valid|invalid x-api-key|authentication|unauthori[sz]ed|permission denied|forbidden");
    private static final Pattern INVALID_MODEL = Pattern.compile(
            "invalid[ _-]?model|model not found|model_not_found|unknown model|model: .* not found");
    private static final Pattern CONTENT_POLICY = Pattern.compile(
            "content[ _-]?policy|safety|blocked|policy violation");

    public Category classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ValidationException) {
                return Category.VALIDATION;
            }
            if (t instanceof ServiceCallException sce && !sce.isFatal() && sce.getStatusCode() > 0) {
                return Category.TRANSIENT;
            }
            String message = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            if (AUTHENTICATION.matcher(message).find()) return Category.AUTHENTICATION;
            if (INVALID_MODEL.matcher(message).find())  return Category.INVALID_MODEL;
            if (CONTENT_POLICY.matcher(message).find()) return Category.CONTENT_POLICY;
            if (t instanceof ServiceCallException sce && sce.isFatal()) {
                return Category.FATAL;
            }
        }
        return Category.TRANSIENT;
    }

    public boolean isRetryable(Throwable error) {
        return classify(error) == Category.TRANSIENT;
    }
}

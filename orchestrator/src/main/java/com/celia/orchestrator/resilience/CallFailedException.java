package com.celia.orchestrator.resilience;

/**
 * Single failure raised by {@link RetryExecutor} once it gives up, either
 * because attempts ran out or because the error was not retryable.
 * The last underlying error is the cause.
 */
public class CallFailedException extends RuntimeException {

    private final String operation;
    private final int attempts;
    private final ErrorClassifier.Category category;

    public CallFailedException(String operation, int attempts, ErrorClassifier.Category category, Throwable lastError) {
        super("%s failed after %d attempt(s) [%s]: %s".formatted(
                operation, attempts, category, lastError.getMessage()), lastError);
        this.operation = operation;
        this.attempts  = attempts;
        this.category  = category;
    }

    public String getOperation()                 { return operation; }
    public int getAttempts()                     { return attempts; }
    public ErrorClassifier.Category getCategory() { return category; }

    /** True when the call was aborted without using the remaining attempts. */
    public boolean isFatal() {
        return category != ErrorClassifier.Category.TRANSIENT;
    }
}

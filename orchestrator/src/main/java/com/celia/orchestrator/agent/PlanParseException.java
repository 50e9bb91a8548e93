package com.celia.orchestrator.agent;

/**
 * The planner's answer could not be turned into a valid {@link com.celia.orchestrator.model.Plan}.
 */
public class PlanParseException extends RuntimeException {

    public PlanParseException(String message) {
        super(message);
    }

    public PlanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

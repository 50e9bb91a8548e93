package com.celia.orchestrator.agent;

import com.celia.orchestrator.llm.GenerationRequest;
import com.celia.orchestrator.llm.LlmProperties;
import com.celia.orchestrator.llm.ResilientCallClient;
import com.celia.orchestrator.model.Plan;
import com.celia.orchestrator.service.JobProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Asks the model for an execution plan.
 *
 * Never fails the job: any call, validation or parsing failure yields the
 * single-step fallback plan, tagged {@link ResultSource#FALLBACK} with the reason.
 * Only interruption (job cancelled) propagates.
 */
@Component
public class PlanGenerator {

    private static final Logger log = LoggerFactory.getLogger(PlanGenerator.class);

    private final ResilientCallClient client;
    private final PlanParser          parser;
    private final int                 maxSteps;
    private final double              temperature;

    @Autowired
    public PlanGenerator(ResilientCallClient client,
                         ObjectMapper objectMapper,
                         JobProperties jobProperties,
                         LlmProperties llmProperties) {
        this(client, new PlanParser(objectMapper), jobProperties.getMaxPlanSteps(), llmProperties.getTemperature());
    }

    PlanGenerator(ResilientCallClient client, PlanParser parser, int maxSteps, double temperature) {
        this.client      = client;
        this.parser      = parser;
        this.maxSteps    = maxSteps;
        this.temperature = temperature;
    }

    /**
     * @param context optional extra context for the planner (the repository reference)
     */
    public PlanResult createPlan(String task, String context) throws InterruptedException {
        GenerationRequest request = GenerationRequest
                .of(Prompts.planPrompt(task, context), Prompts.PLANNER_SYSTEM, true)
                .withTemperature(temperature);
        try {
            String answer = client.generate(request);
            Plan plan = parser.parse(answer, maxSteps);
            log.info("Plan created with {} step(s)", plan.size());
            return PlanResult.generated(plan);
        } catch (InterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Planning failed, substituting fallback plan: {}", e.getMessage());
            return PlanResult.fallback(e.getMessage());
        }
    }
}

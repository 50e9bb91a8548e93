package com.celia.orchestrator.agent;

import com.celia.orchestrator.model.Plan;
import com.celia.orchestrator.model.PlanStep;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the planner's JSON answer into a {@link Plan}.
 *
 * Accepted top-level shapes: a JSON array of step objects, or an object with a
 * {@code steps} array. Anything else rejects the whole plan. Missing per-step
 * fields are defaulted; dependency references to unknown steps are dropped.
 * Duplicate step numbers or a dependency cycle reject the plan.
 */
public class PlanParser {

    private static final Logger log = LoggerFactory.getLogger(PlanParser.class);

    static final String DEFAULT_ACTION  = "Unnamed step";
    static final String DEFAULT_OUTCOME = "Not specified";

    // ```json ... ``` or ``` ... ``` around the payload
    private static final Pattern FENCE = Pattern.compile(
            "^```[a-zA-Z]*\\s*\\n?(.*?)\\n?```$", Pattern.DOTALL);

    private final ObjectMapper json;

    public PlanParser(ObjectMapper json) {
        this.json = json;
    }

    /**
     * @param maxSteps plans longer than this are truncated
     * @throws PlanParseException if the text is not a usable plan
     */
    public Plan parse(String text, int maxSteps) {
        if (text == null || text.isBlank()) {
            throw new PlanParseException("Planner returned an empty answer");
        }
        JsonNode root;
        try {
            root = json.readTree(stripFence(text.strip()));
        } catch (JsonProcessingException e) {
            throw new PlanParseException("Planner answer is not JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode stepsNode = root;
        if (root.isObject() && root.has("steps")) {
            stepsNode = root.get("steps");
        }
        if (!stepsNode.isArray()) {
            throw new PlanParseException("Expected a JSON array of steps, got " + root.getNodeType());
        }
        if (stepsNode.isEmpty()) {
            throw new PlanParseException("Plan contains no steps");
        }

        List<PlanStep> steps = new ArrayList<>();
        int position = 0;
        for (JsonNode node : stepsNode) {
            position++;
            if (steps.size() == maxSteps) {
                log.warn("Plan has {} steps, truncating to {}", stepsNode.size(), maxSteps);
                break;
            }
            if (!node.isObject()) {
                throw new PlanParseException("Step " + position + " is not an object");
            }
            steps.add(toStep(node, position));
        }

        return new Plan(validateDependencies(steps));
    }

    private PlanStep toStep(JsonNode node, int position) {
        int number = node.path("step_number").canConvertToInt()
                ? node.path("step_number").asInt()
                : position;
        return new PlanStep(
                number,
                textOr(node.get("action"), DEFAULT_ACTION),
                textOr(node.get("expected_outcome"), DEFAULT_OUTCOME),
                stringList(node.get("commands")),
                textOr(node.get("estimated_time"), null),
                intList(node.get("dependencies")));
    }

    /** Drop unknown and self references; reject duplicates and cycles. */
    private List<PlanStep> validateDependencies(List<PlanStep> steps) {
        Set<Integer> numbers = new HashSet<>();
        for (PlanStep step : steps) {
            if (!numbers.add(step.stepNumber())) {
                throw new PlanParseException("Duplicate step number " + step.stepNumber());
            }
        }

        List<PlanStep> cleaned = new ArrayList<>(steps.size());
        Map<Integer, List<Integer>> graph = new HashMap<>();
        for (PlanStep step : steps) {
            List<Integer> deps = new ArrayList<>();
            for (int dep : new LinkedHashSet<>(step.dependencies())) {
                if (dep == step.stepNumber() || !numbers.contains(dep)) {
                    log.warn("Step {} depends on unknown step {}, ignoring", step.stepNumber(), dep);
                } else {
                    deps.add(dep);
                }
            }
            graph.put(step.stepNumber(), deps);
            cleaned.add(new PlanStep(step.stepNumber(), step.action(), step.expectedOutcome(),
                    step.commands(), step.estimatedTime(), deps));
        }

        Map<Integer, Integer> state = new HashMap<>();   // 1 = visiting, 2 = done
        for (Integer start : graph.keySet()) {
            if (hasCycle(start, graph, state)) {
                throw new PlanParseException("Step dependencies form a cycle through step " + start);
            }
        }
        return cleaned;
    }

    private static boolean hasCycle(Integer node, Map<Integer, List<Integer>> graph, Map<Integer, Integer> state) {
        Integer s = state.get(node);
        if (s != null) {
            return s == 1;
        }
        state.put(node, 1);
        for (Integer next : graph.getOrDefault(node, List.of())) {
            if (hasCycle(next, graph, state)) {
                return true;
            }
        }
        state.put(node, 2);
        return false;
    }

    static String stripFence(String text) {
        Matcher m = FENCE.matcher(text);
        return m.matches() ? m.group(1).strip() : text;
    }

    private static String textOr(JsonNode node, String fallback) {
        if (node == null || node.isNull()) return fallback;
        String value = node.isTextual() ? node.asText() : node.toString();
        return value.isBlank() ? fallback : value.strip();
    }

    private static List<String> stringList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) return out;
        if (!node.isArray()) {
            String single = textOr(node, null);
            if (single != null) out.add(single);
            return out;
        }
        for (JsonNode item : node) {
            String value = textOr(item, null);
            if (value != null) out.add(value);
        }
        return out;
    }

    private static List<Integer> intList(JsonNode node) {
        List<Integer> out = new ArrayList<>();
        if (node == null || !node.isArray()) return out;
        for (JsonNode item : node) {
            if (item.canConvertToInt()) {
                out.add(item.asInt());
            } else if (item.isTextual() && item.asText().strip().matches("\\d+")) {
                out.add(Integer.parseInt(item.asText().strip()));
            }
        }
        return out;
    }
}

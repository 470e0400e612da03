/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.tessera.examples;

import dev.mars.tessera.workflow.executor.StepExecutor;
import dev.mars.tessera.workflow.executor.StepExecutorRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Stub agents for the requirements-analysis workflow. Each agent derives its outputs
 * deterministically from its inputs so runs are reproducible.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class RequirementsAgents {

    public static final String REQUIREMENTS_ANALYZER = "requirements_analyzer";
    public static final String REQUIREMENT_CLARIFIER = "requirement_clarifier";
    public static final String BUSINESS_ANALYST = "business_analyst";
    public static final String TECHNICAL_ANALYST = "technical_analyst";
    public static final String QUALITY_REVIEWER = "quality_reviewer";
    public static final String TECHNICAL_WRITER = "technical_writer";

    private RequirementsAgents() {
    }

    /**
     * Registers one stub executor per agent type used by the workflow.
     */
    public static StepExecutorRegistry registerAll(StepExecutorRegistry registry) {
        return registry
                .register(REQUIREMENTS_ANALYZER, RequirementsAgents::analyze)
                .register(REQUIREMENT_CLARIFIER, RequirementsAgents::clarify)
                .register(BUSINESS_ANALYST, RequirementsAgents::analyzeBusiness)
                .register(TECHNICAL_ANALYST, RequirementsAgents::analyzeTechnology)
                .register(QUALITY_REVIEWER, RequirementsAgents::review)
                .register(TECHNICAL_WRITER, RequirementsAgents::document);
    }

    static CompletableFuture<Map<String, Object>> analyze(Map<String, Object> inputs) {
        String requirements = String.valueOf(inputs.get("initial_requirements"));
        List<String> points = new ArrayList<>();
        for (String sentence : requirements.split("[.;\\n]")) {
            if (!sentence.isBlank()) {
                points.add(sentence.trim());
            }
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("initial_analysis_result", "Identified " + points.size() + " requirement points for "
                + inputs.get("project_context"));
        output.put("requirement_points", points);
        output.put("analysis_depth", points.size() > 3 ? "deep" : "standard");
        return CompletableFuture.completedFuture(output);
    }

    static CompletableFuture<Map<String, Object>> clarify(Map<String, Object> inputs) {
        List<?> points = (List<?>) inputs.get("requirement_points");
        List<String> questions = new ArrayList<>();
        List<String> clarified = new ArrayList<>();
        for (Object point : points) {
            clarified.add(point + " (confirmed)");
            questions.add("What is the acceptance criterion for '" + point + "'?");
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("clarified_requirements", clarified);
        output.put("clarification_questions", questions);
        return CompletableFuture.completedFuture(output);
    }

    static CompletableFuture<Map<String, Object>> analyzeBusiness(Map<String, Object> inputs) {
        List<?> clarified = (List<?>) inputs.get("clarified_requirements");
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("business_analysis_result", "Business value assessed for " + clarified.size() + " requirements");
        output.put("business_rules", List.of("Every order must have an owner", "Audit trail retained for 7 years"));
        return CompletableFuture.completedFuture(output);
    }

    static CompletableFuture<Map<String, Object>> analyzeTechnology(Map<String, Object> inputs) {
        List<?> rules = (List<?>) inputs.get("business_rules");
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("technical_analysis_result", "Feasible; " + rules.size() + " business rules map to services");
        output.put("technical_constraints", List.of("JDK 17", "Relational storage for audit data"));
        return CompletableFuture.supplyAsync(() -> output);
    }

    static CompletableFuture<Map<String, Object>> review(Map<String, Object> inputs) {
        Map<String, Object> output = new LinkedHashMap<>();
        boolean constrained = inputs.containsKey("technical_constraints");
        output.put("quality_review_result", constrained ? "approved" : "approved with reservations");
        output.put("improvement_suggestions", List.of("Quantify performance targets"));
        return CompletableFuture.completedFuture(output);
    }

    static CompletableFuture<Map<String, Object>> document(Map<String, Object> inputs) {
        StringBuilder document = new StringBuilder("# Requirements Specification\n");
        for (Object requirement : (List<?>) inputs.get("clarified_requirements")) {
            document.append("- ").append(requirement).append('\n');
        }
        document.append("\n## Business\n").append(inputs.get("business_analysis_result")).append('\n');
        document.append("\n## Technical\n").append(inputs.get("technical_analysis_result")).append('\n');
        document.append("\n## Review\n").append(inputs.get("quality_review_result")).append('\n');
        Object suggestions = inputs.get("improvement_suggestions");
        if (suggestions != null) {
            document.append("\n## Suggestions\n").append(suggestions).append('\n');
        }
        return CompletableFuture.completedFuture(Map.of("requirements_document", document.toString()));
    }

    /**
     * Wraps an executor so it fails with the given error for its first {@code failures} calls.
     */
    public static StepExecutor failingFirst(int failures, Exception error, StepExecutor delegate) {
        int[] remaining = {failures};
        return inputs -> {
            synchronized (remaining) {
                if (remaining[0] > 0) {
                    remaining[0]--;
                    return CompletableFuture.failedFuture(error);
                }
            }
            return delegate.execute(inputs);
        };
    }
}

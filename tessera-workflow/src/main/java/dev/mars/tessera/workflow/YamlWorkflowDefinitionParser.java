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


package dev.mars.tessera.workflow;

import dev.mars.tessera.workflow.exceptions.WorkflowParseException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses YAML workflow definitions using SnakeYAML.
 *
 * <pre>
 * id: order-review
 * strategy: parallel
 * maxExecutionTime: 10m
 * initialInputs: [order]
 * steps:
 *   - name: check
 *     agentType: checker
 *     requiredInputs: [order]
 *     outputs: [verdict]
 *     timeout: 30s
 *     retry: { maxRetries: 2, baseDelay: 500ms, maxDelay: 5s, retryOn: [timeout, io] }
 * dependencies:
 *   report: [check]
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private final Yaml yaml;
    private final WorkflowSchemaValidator schemaValidator;

    public YamlWorkflowDefinitionParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.schemaValidator = new WorkflowSchemaValidator();
    }

    @Override
    public WorkflowDefinition parse(Path yamlFile) throws WorkflowParseException {
        try {
            String content = Files.readString(yamlFile);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + yamlFile, e);
        }
    }

    @Override
    public WorkflowDefinition parseFromString(String yamlContent) throws WorkflowParseException {
        Map<String, Object> data = load(yamlContent);

        ValidationResult schema = schemaValidator.validateWorkflowSchema(data);
        if (!schema.isValid()) {
            ValidationResult.ValidationIssue first = schema.getErrors().get(0);
            String message = first.getMessage();
            if (schema.getErrorCount() > 1) {
                message += " (and " + (schema.getErrorCount() - 1) + " more)";
            }
            throw new WorkflowParseException(stringValue(data.get("id")), first.getFieldPath(), message);
        }

        return parseWorkflowDefinition(data);
    }

    @Override
    public ValidationResult validate(WorkflowDefinition definition) {
        return definition.validate();
    }

    @Override
    public ValidationResult validateSchema(String yamlContent) {
        ValidationResult result = new ValidationResult();
        try {
            Map<String, Object> data = load(yamlContent);
            result.merge(schemaValidator.validateWorkflowSchema(data));
        } catch (WorkflowParseException e) {
            result.addError(ValidationCode.SCHEMA, e.getMessage());
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> load(String yamlContent) throws WorkflowParseException {
        if (yamlContent == null || yamlContent.isBlank()) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        Object loaded;
        try {
            loaded = yaml.load(yamlContent);
        } catch (MarkedYAMLException e) {
            Mark mark = e.getProblemMark();
            int line = mark != null ? mark.getLine() + 1 : -1;
            throw new WorkflowParseException(null, line, null, "YAML syntax error: " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed", e);
        }
        if (!(loaded instanceof Map)) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        return (Map<String, Object>) loaded;
    }

    private WorkflowDefinition parseWorkflowDefinition(Map<String, Object> data) throws WorkflowParseException {
        String id = getStringValue(data, "id");

        WorkflowDefinition.Builder builder = WorkflowDefinition.builder(id)
                .name(getStringValue(data, "name", id))
                .description(getStringValue(data, "description"))
                .version(getStringValue(data, "version", "1.0.0"))
                .strategy(ExecutionStrategy.fromName(getStringValue(data, "strategy", "sequential")))
                .initialInputs(getStringList(data, "initialInputs"))
                .metadata(getMapValue(data, "metadata"));

        if (data.get("maxExecutionTime") != null) {
            try {
                builder.maxExecutionTime(DurationFormat.parse(data.get("maxExecutionTime")));
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException(id, "maxExecutionTime", e.getMessage());
            }
        }

        List<Map<String, Object>> steps = getListValue(data, "steps");
        for (int i = 0; i < steps.size(); i++) {
            try {
                builder.step(parseStep(steps.get(i)));
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException(id, "steps[" + i + "]", e.getMessage());
            }
        }

        Map<String, Object> dependencies = getMapValue(data, "dependencies");
        if (dependencies != null) {
            for (Map.Entry<String, Object> entry : dependencies.entrySet()) {
                try {
                    builder.dependency(entry.getKey(), toStringList(entry.getValue()));
                } catch (IllegalArgumentException e) {
                    throw new WorkflowParseException(id, "dependencies." + entry.getKey(), e.getMessage());
                }
            }
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(id, null, e.getMessage());
        }
    }

    private Step parseStep(Map<String, Object> data) {
        Step.Builder builder = Step.builder(getStringValue(data, "name"))
                .description(getStringValue(data, "description"))
                .agentType(getStringValue(data, "agentType"))
                .requiredInputs(getStringList(data, "requiredInputs"))
                .optionalInputs(getStringList(data, "optionalInputs"))
                .outputs(getStringList(data, "outputs"))
                .metadata(getMapValue(data, "metadata"));

        if (data.get("timeout") != null) {
            builder.timeout(DurationFormat.parse(data.get("timeout")));
        }

        Map<String, Object> retry = getMapValue(data, "retry");
        if (retry != null) {
            builder.retryPolicy(parseRetryPolicy(retry));
        }
        return builder.build();
    }

    private RetryPolicy parseRetryPolicy(Map<String, Object> data) {
        RetryPolicy defaults = RetryPolicy.defaultPolicy();
        int maxRetries = getIntValue(data, "maxRetries", defaults.getMaxRetries());
        Duration baseDelay = data.get("baseDelay") != null
                ? DurationFormat.parse(data.get("baseDelay"))
                : defaults.getBaseDelay();
        Duration maxDelay = data.get("maxDelay") != null
                ? DurationFormat.parse(data.get("maxDelay"))
                : (baseDelay.compareTo(defaults.getMaxDelay()) > 0 ? baseDelay : defaults.getMaxDelay());

        List<StepFailureKind> kinds = new ArrayList<>();
        if (data.containsKey("retryOn")) {
            for (String kind : getStringList(data, "retryOn")) {
                kinds.add(StepFailureKind.fromName(kind));
            }
        } else {
            kinds.addAll(StepFailureKind.defaultRetryable());
        }
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, kinds);
    }

    // Utility methods for safe type conversion
    private String getStringValue(Map<String, Object> data, String key) {
        return getStringValue(data, key, null);
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> getListValue(Map<String, Object> data, String key) {
        if (data == null) return List.of();
        Object value = data.get(key);
        return value instanceof List ? (List<Map<String, Object>>) value : List.of();
    }

    private List<String> getStringList(Map<String, Object> data, String key) {
        return data == null ? List.of() : toStringList(data.get(key));
    }

    private int getIntValue(Map<String, Object> data, String key, int defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static List<String> toStringList(Object value) {
        if (value == null) return List.of();
        if (value instanceof String) return List.of((String) value);
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }
}

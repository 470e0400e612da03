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

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Schema validator for YAML workflow documents.
 * Checks the raw document structure, field types and value formats before a
 * {@link WorkflowDefinition} is built from it. Every issue is reported with
 * {@link ValidationCode#SCHEMA} and a field path such as {@code steps[2].retry.retryOn[0]}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowSchemaValidator {

    // Regex patterns for validation
    private static final Pattern ID_PATTERN = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9\\-_.]*$");
    private static final Pattern STEP_NAME_PATTERN = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9\\-_]*$");
    private static final Pattern VERSION_PATTERN = Pattern.compile("^[0-9]+\\.[0-9]+\\.[0-9]+(-[a-zA-Z0-9\\-\\.]+)?(\\+[a-zA-Z0-9\\-\\.]+)?$");

    private static final Set<String> ROOT_FIELDS = Set.of(
        "id", "name", "description", "version", "strategy", "maxExecutionTime",
        "initialInputs", "metadata", "steps", "dependencies"
    );

    private static final Set<String> STEP_FIELDS = Set.of(
        "name", "description", "agentType", "requiredInputs", "optionalInputs",
        "outputs", "timeout", "retry", "metadata"
    );

    private static final Set<String> RETRY_FIELDS = Set.of("maxRetries", "baseDelay", "maxDelay", "retryOn");

    /**
     * Validates the complete workflow document.
     */
    public ValidationResult validateWorkflowSchema(Map<String, Object> data) {
        ValidationResult result = new ValidationResult();
        if (data == null) {
            result.addError(ValidationCode.SCHEMA, "Workflow document cannot be empty");
            return result;
        }

        validateRootStructure(data, result);

        Object steps = data.get("steps");
        if (steps instanceof List) {
            validateSteps((List<?>) steps, result);
        }

        Object dependencies = data.get("dependencies");
        if (dependencies != null) {
            validateDependencies(dependencies, result);
        }

        return result;
    }

    private void validateRootStructure(Map<String, Object> data, ValidationResult result) {
        // Required fields
        Object id = data.get("id");
        if (id == null) {
            result.addError(ValidationCode.SCHEMA, "id", "Required field 'id' is missing");
        } else if (!(id instanceof String) || ((String) id).isBlank()) {
            result.addError(ValidationCode.SCHEMA, "id", "Field 'id' must be a non-empty string");
        } else if (!ID_PATTERN.matcher((String) id).matches()) {
            result.addError(ValidationCode.SCHEMA, "id",
                    "Id must start with a letter or digit and contain only letters, digits, '-', '_' or '.'");
        }

        Object steps = data.get("steps");
        if (steps == null) {
            result.addError(ValidationCode.SCHEMA, "steps", "Required field 'steps' is missing");
        } else if (!(steps instanceof List)) {
            result.addError(ValidationCode.SCHEMA, "steps", "Field 'steps' must be a list");
        } else if (((List<?>) steps).isEmpty()) {
            result.addError(ValidationCode.SCHEMA, "steps", "Field 'steps' must contain at least one step");
        }

        checkOptionalString(data, "name", "name", result);
        checkOptionalString(data, "description", "description", result);

        if (data.containsKey("version")) {
            String version = stringValue(data.get("version"));
            if (version == null || !VERSION_PATTERN.matcher(version).matches()) {
                result.addError(ValidationCode.SCHEMA, "version",
                        "Version must follow semantic versioning format (e.g., '1.0.0', '2.1.0-beta')");
            }
        }

        if (data.containsKey("strategy")) {
            Object strategy = data.get("strategy");
            if (!(strategy instanceof String) || !isStrategy((String) strategy)) {
                result.addError(ValidationCode.SCHEMA, "strategy",
                        "Strategy must be one of 'sequential', 'parallel' or 'adaptive', got: " + strategy);
            }
        }

        if (data.containsKey("maxExecutionTime")) {
            Object maxExecutionTime = data.get("maxExecutionTime");
            if (!DurationFormat.isValid(maxExecutionTime)) {
                result.addError(ValidationCode.SCHEMA, "maxExecutionTime",
                        "Invalid duration '" + maxExecutionTime + "', expected e.g. 500ms, 30s, 5m or 2h");
            } else if (DurationFormat.parse(maxExecutionTime).isZero()) {
                result.addError(ValidationCode.SCHEMA, "maxExecutionTime", "Max execution time must be positive");
            }
        }

        checkStringList(data, "initialInputs", "initialInputs", result);

        if (data.containsKey("metadata") && !(data.get("metadata") instanceof Map)) {
            result.addError(ValidationCode.SCHEMA, "metadata", "Field 'metadata' must be a map");
        }

        for (String key : data.keySet()) {
            if (!ROOT_FIELDS.contains(key)) {
                result.addWarning(ValidationCode.SCHEMA, key, "Unknown field '" + key + "' is ignored");
            }
        }
    }

    private void validateSteps(List<?> steps, ValidationResult result) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            String path = "steps[" + i + "]";
            Object entry = steps.get(i);
            if (!(entry instanceof Map)) {
                result.addError(ValidationCode.SCHEMA, path, "Step must be a map");
                continue;
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> step = (Map<String, Object>) entry;
            validateStep(step, path, result);

            String name = stringValue(step.get("name"));
            if (name != null && !names.add(name)) {
                result.addError(ValidationCode.SCHEMA, path + ".name", "Duplicate step name: " + name);
            }
        }
    }

    private void validateStep(Map<String, Object> step, String path, ValidationResult result) {
        Object name = step.get("name");
        if (name == null) {
            result.addError(ValidationCode.SCHEMA, path + ".name", "Required field 'name' is missing");
        } else if (!(name instanceof String) || !STEP_NAME_PATTERN.matcher((String) name).matches()) {
            result.addError(ValidationCode.SCHEMA, path + ".name",
                    "Step name must start with a letter or underscore and contain only letters, digits, '-' or '_'");
        }

        Object agentType = step.get("agentType");
        if (agentType == null) {
            result.addError(ValidationCode.SCHEMA, path + ".agentType", "Required field 'agentType' is missing");
        } else if (!(agentType instanceof String) || ((String) agentType).isBlank()) {
            result.addError(ValidationCode.SCHEMA, path + ".agentType", "Field 'agentType' must be a non-empty string");
        }

        checkOptionalString(step, "description", path + ".description", result);
        checkStringList(step, "requiredInputs", path + ".requiredInputs", result);
        checkStringList(step, "optionalInputs", path + ".optionalInputs", result);
        checkStringList(step, "outputs", path + ".outputs", result);

        if (step.containsKey("timeout")) {
            Object timeout = step.get("timeout");
            if (!DurationFormat.isValid(timeout)) {
                result.addError(ValidationCode.SCHEMA, path + ".timeout",
                        "Invalid duration '" + timeout + "', expected e.g. 500ms, 30s, 5m or 2h");
            } else if (DurationFormat.parse(timeout).isZero()) {
                result.addError(ValidationCode.SCHEMA, path + ".timeout", "Timeout must be positive");
            }
        }

        if (step.containsKey("retry")) {
            Object retry = step.get("retry");
            if (retry instanceof Map) {
                @SuppressWarnings("unchecked")
                Map<String, Object> retryMap = (Map<String, Object>) retry;
                validateRetry(retryMap, path + ".retry", result);
            } else {
                result.addError(ValidationCode.SCHEMA, path + ".retry", "Field 'retry' must be a map");
            }
        }

        if (step.containsKey("metadata") && !(step.get("metadata") instanceof Map)) {
            result.addError(ValidationCode.SCHEMA, path + ".metadata", "Field 'metadata' must be a map");
        }

        for (String key : step.keySet()) {
            if (!STEP_FIELDS.contains(key)) {
                result.addWarning(ValidationCode.SCHEMA, path + "." + key, "Unknown step field '" + key + "' is ignored");
            }
        }
    }

    private void validateRetry(Map<String, Object> retry, String path, ValidationResult result) {
        if (retry.containsKey("maxRetries")) {
            Object maxRetries = retry.get("maxRetries");
            if (!(maxRetries instanceof Integer) || (Integer) maxRetries < 0) {
                result.addError(ValidationCode.SCHEMA, path + ".maxRetries", "Field 'maxRetries' must be a non-negative integer");
            }
        }
        for (String field : List.of("baseDelay", "maxDelay")) {
            if (retry.containsKey(field) && !DurationFormat.isValid(retry.get(field))) {
                result.addError(ValidationCode.SCHEMA, path + "." + field,
                        "Invalid duration '" + retry.get(field) + "', expected e.g. 500ms, 30s, 5m or 2h");
            }
        }
        if (DurationFormat.isValid(retry.get("baseDelay")) && DurationFormat.isValid(retry.get("maxDelay"))
                && DurationFormat.parse(retry.get("maxDelay")).compareTo(DurationFormat.parse(retry.get("baseDelay"))) < 0) {
            result.addError(ValidationCode.SCHEMA, path + ".maxDelay", "Field 'maxDelay' cannot be shorter than 'baseDelay'");
        }

        Object retryOn = retry.get("retryOn");
        if (retryOn != null) {
            if (!(retryOn instanceof List)) {
                result.addError(ValidationCode.SCHEMA, path + ".retryOn", "Field 'retryOn' must be a list of failure kinds");
            } else {
                List<?> kinds = (List<?>) retryOn;
                for (int i = 0; i < kinds.size(); i++) {
                    Object kind = kinds.get(i);
                    if (!(kind instanceof String) || !isFailureKind((String) kind)) {
                        result.addError(ValidationCode.SCHEMA, path + ".retryOn[" + i + "]",
                                "Unknown failure kind '" + kind + "'");
                    }
                }
            }
        }

        for (String key : retry.keySet()) {
            if (!RETRY_FIELDS.contains(key)) {
                result.addWarning(ValidationCode.SCHEMA, path + "." + key, "Unknown retry field '" + key + "' is ignored");
            }
        }
    }

    private void validateDependencies(Object dependencies, ValidationResult result) {
        if (!(dependencies instanceof Map)) {
            result.addError(ValidationCode.SCHEMA, "dependencies",
                    "Field 'dependencies' must map step names to lists of required steps");
            return;
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) dependencies).entrySet()) {
            String path = "dependencies." + entry.getKey();
            if (!(entry.getKey() instanceof String)) {
                result.addError(ValidationCode.SCHEMA, path, "Dependency key must be a step name");
                continue;
            }
            Object value = entry.getValue();
            if (value instanceof String) {
                continue;
            }
            if (!(value instanceof List)) {
                result.addError(ValidationCode.SCHEMA, path, "Dependencies must be a list of step names");
                continue;
            }
            List<?> required = (List<?>) value;
            for (int i = 0; i < required.size(); i++) {
                if (!(required.get(i) instanceof String)) {
                    result.addError(ValidationCode.SCHEMA, path + "[" + i + "]", "Dependency must be a step name");
                }
            }
        }
    }

    private void checkOptionalString(Map<String, Object> data, String key, String path, ValidationResult result) {
        if (data.containsKey(key) && data.get(key) != null && !(data.get(key) instanceof String)) {
            result.addError(ValidationCode.SCHEMA, path, "Field '" + key + "' must be a string");
        }
    }

    private void checkStringList(Map<String, Object> data, String key, String path, ValidationResult result) {
        Object value = data.get(key);
        if (value == null) {
            return;
        }
        if (!(value instanceof List)) {
            result.addError(ValidationCode.SCHEMA, path, "Field '" + key + "' must be a list of strings");
            return;
        }
        List<?> items = (List<?>) value;
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (!(item instanceof String) || ((String) item).isBlank()) {
                result.addError(ValidationCode.SCHEMA, path + "[" + i + "]", "Entry must be a non-empty string");
            }
        }
    }

    private static boolean isStrategy(String value) {
        try {
            ExecutionStrategy.fromName(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isFailureKind(String value) {
        try {
            StepFailureKind.fromName(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }
}

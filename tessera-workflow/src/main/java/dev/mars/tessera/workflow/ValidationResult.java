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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered collection of validation errors and warnings, each tagged with a
 * {@link ValidationCode}. A result is valid when it holds no errors; warnings never
 * block registration.
 */
public class ValidationResult {

    private final List<ValidationIssue> issues = new ArrayList<>();

    public ValidationResult() {
    }

    public ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        if (errors != null) {
            issues.addAll(errors);
        }
        if (warnings != null) {
            issues.addAll(warnings);
        }
    }

    public void addError(ValidationCode code, String message) {
        addError(code, null, message);
    }

    public void addError(ValidationCode code, String fieldPath, String message) {
        issues.add(new ValidationIssue(ValidationIssue.Severity.ERROR, code, fieldPath, message));
    }

    public void addWarning(ValidationCode code, String message) {
        addWarning(code, null, message);
    }

    public void addWarning(ValidationCode code, String fieldPath, String message) {
        issues.add(new ValidationIssue(ValidationIssue.Severity.WARNING, code, fieldPath, message));
    }

    /**
     * Appends all issues of {@code other} to this result.
     */
    public void merge(ValidationResult other) {
        if (other != null) {
            issues.addAll(other.issues);
        }
    }

    public List<ValidationIssue> getErrors() {
        return select(ValidationIssue.Severity.ERROR);
    }

    public List<ValidationIssue> getWarnings() {
        return select(ValidationIssue.Severity.WARNING);
    }

    public boolean isValid() {
        return getErrorCount() == 0;
    }

    public boolean hasWarnings() {
        return getWarningCount() > 0;
    }

    public boolean hasError(ValidationCode code) {
        return issues.stream().anyMatch(issue -> issue.isError() && issue.getCode() == code);
    }

    public int getErrorCount() {
        return (int) issues.stream().filter(ValidationIssue::isError).count();
    }

    public int getWarningCount() {
        return issues.size() - getErrorCount();
    }

    private List<ValidationIssue> select(ValidationIssue.Severity severity) {
        return issues.stream()
                .filter(issue -> issue.getSeverity() == severity)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid()
                + ", errors=" + getErrorCount()
                + ", warnings=" + getWarningCount() + "}";
    }

    /**
     * A single error or warning. The field path locates the problem in the definition,
     * for example {@code steps[2].timeout} or {@code dependencies.report}, and may be null.
     */
    public static class ValidationIssue {

        public enum Severity {
            ERROR, WARNING
        }

        private final Severity severity;
        private final ValidationCode code;
        private final String fieldPath;
        private final String message;

        public ValidationIssue(Severity severity, ValidationCode code, String fieldPath, String message) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.code = Objects.requireNonNull(code, "Code cannot be null");
            this.fieldPath = fieldPath;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public Severity getSeverity() {
            return severity;
        }

        public boolean isError() {
            return severity == Severity.ERROR;
        }

        public ValidationCode getCode() {
            return code;
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ValidationIssue)) return false;
            ValidationIssue other = (ValidationIssue) o;
            return severity == other.severity
                    && code == other.code
                    && Objects.equals(fieldPath, other.fieldPath)
                    && message.equals(other.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, code, fieldPath, message);
        }

        @Override
        public String toString() {
            String location = fieldPath != null ? " [" + fieldPath + "]" : "";
            return severity + " " + code + location + ": " + message;
        }
    }
}

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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for ValidationResult.
 */
class ValidationResultTest {

    @Test
    void testEmptyResultIsValid() {
        ValidationResult result = new ValidationResult();

        assertTrue(result.isValid());
        assertFalse(result.hasWarnings());
        assertEquals(0, result.getErrorCount());
    }

    @Test
    void testWarningsDoNotInvalidate() {
        ValidationResult result = new ValidationResult();
        result.addWarning(ValidationCode.DUPLICATE_OUTPUT, "steps.b.outputs", "Output 'x' is produced twice");

        assertTrue(result.isValid());
        assertTrue(result.hasWarnings());
        assertEquals(1, result.getWarningCount());
    }

    @Test
    void testErrorsKeepOrderAndCodes() {
        ValidationResult result = new ValidationResult();
        result.addError(ValidationCode.UNKNOWN_STEP, "dependencies.b", "first");
        result.addError(ValidationCode.CYCLE, "second");

        assertFalse(result.isValid());
        assertEquals("first", result.getErrors().get(0).getMessage());
        assertEquals("dependencies.b", result.getErrors().get(0).getFieldPath());
        assertNull(result.getErrors().get(1).getFieldPath());
        assertTrue(result.hasError(ValidationCode.CYCLE));
        assertFalse(result.hasError(ValidationCode.EMPTY_WORKFLOW));
    }

    @Test
    void testMerge() {
        ValidationResult first = new ValidationResult();
        first.addError(ValidationCode.SCHEMA, "id", "Missing id");
        ValidationResult second = new ValidationResult();
        second.addWarning(ValidationCode.SCHEMA, "extra", "Unknown field");

        first.merge(second);
        first.merge(null);

        assertEquals(1, first.getErrorCount());
        assertEquals(1, first.getWarningCount());
    }

    @Test
    void testIssueToString() {
        ValidationResult.ValidationIssue issue = new ValidationResult.ValidationIssue(
                ValidationResult.ValidationIssue.Severity.ERROR, ValidationCode.SCHEMA, "steps[0].name", "Missing name");

        assertEquals("ERROR SCHEMA [steps[0].name]: Missing name", issue.toString());
    }
}

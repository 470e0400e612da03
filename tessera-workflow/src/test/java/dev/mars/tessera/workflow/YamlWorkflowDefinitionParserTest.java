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
import dev.mars.tessera.workflow.exceptions.WorkflowValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for YamlWorkflowDefinitionParser.
 */
class YamlWorkflowDefinitionParserTest {

    private static final String ORDER_REVIEW = String.join("\n",
            "id: order-review",
            "name: Order Review",
            "description: Checks and reports on an order",
            "version: 2.1.0",
            "strategy: parallel",
            "maxExecutionTime: 10m",
            "initialInputs: [order]",
            "metadata:",
            "  owner: ops",
            "steps:",
            "  - name: check",
            "    agentType: checker",
            "    requiredInputs: [order]",
            "    outputs: [verdict]",
            "    timeout: 30s",
            "    retry:",
            "      maxRetries: 2",
            "      baseDelay: 500ms",
            "      maxDelay: 5s",
            "      retryOn: [timeout]",
            "  - name: price",
            "    agentType: pricer",
            "    requiredInputs: [order]",
            "    optionalInputs: [verdict]",
            "    outputs: [price]",
            "  - name: report",
            "    agentType: writer",
            "    requiredInputs: [verdict, price]",
            "    outputs: [report]",
            "    retry: {}",
            "dependencies:",
            "  report: [check, price]",
            "  price: check",
            "");

    private YamlWorkflowDefinitionParser parser;

    @BeforeEach
    void setUp() {
        parser = new YamlWorkflowDefinitionParser();
    }

    @Test
    void testParseCompleteDocument() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(ORDER_REVIEW);

        assertEquals("order-review", definition.getId());
        assertEquals("Order Review", definition.getName());
        assertEquals("2.1.0", definition.getVersion());
        assertEquals(ExecutionStrategy.PARALLEL, definition.getStrategy());
        assertEquals(Duration.ofMinutes(10), definition.getMaxExecutionTime());
        assertEquals(Set.of("order"), definition.getInitialInputs());
        assertEquals(Map.of("owner", "ops"), definition.getMetadata());
        assertEquals(List.of("check", "price", "report"), definition.getStepNames());
        assertEquals(List.of("check", "price"), definition.getStepDependencies("report"));
        assertEquals(List.of("check"), definition.getStepDependencies("price"));
        assertTrue(definition.validate().isValid());
    }

    @Test
    void testStepSettings() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(ORDER_REVIEW);

        Step check = definition.getStep("check").orElseThrow();
        assertEquals(Duration.ofSeconds(30), check.getTimeout());
        assertEquals(new RetryPolicy(2, Duration.ofMillis(500), Duration.ofSeconds(5),
                List.of(StepFailureKind.TIMEOUT)), check.getRetryPolicy());

        Step price = definition.getStep("price").orElseThrow();
        assertNull(price.getTimeout());
        assertNull(price.getRetryPolicy());
        assertEquals(Set.of("verdict"), price.getOptionalInputs());

        // an empty retry block means the default policy
        assertEquals(RetryPolicy.defaultPolicy(), definition.getStep("report").orElseThrow().getRetryPolicy());
    }

    @Test
    void testDefaultsForMinimalDocument() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(String.join("\n",
                "id: minimal",
                "steps:",
                "  - name: only",
                "    agentType: worker"));

        assertEquals("minimal", definition.getName());
        assertEquals("1.0.0", definition.getVersion());
        assertEquals(ExecutionStrategy.SEQUENTIAL, definition.getStrategy());
        assertNull(definition.getMaxExecutionTime());
        assertTrue(definition.getDependencies().isEmpty());
    }

    @Test
    void testParseFromFile(@TempDir Path directory) throws Exception {
        Path file = directory.resolve("order-review.yaml");
        Files.writeString(file, ORDER_REVIEW);

        assertEquals("order-review", parser.parse(file).getId());
    }

    @Test
    void testMissingFile(@TempDir Path directory) {
        WorkflowParseException exception = assertThrows(WorkflowParseException.class,
                () -> parser.parse(directory.resolve("absent.yaml")));
        assertThat(exception.getMessage()).contains("Failed to read YAML file");
    }

    @Test
    void testEmptyContent() {
        assertThrows(WorkflowParseException.class, () -> parser.parseFromString("  "));
        WorkflowParseException exception = assertThrows(WorkflowParseException.class,
                () -> parser.parseFromString("just a scalar"));
        assertEquals("Empty or invalid YAML content", exception.getMessage());
    }

    @Test
    void testSyntaxErrorReportsLine() {
        WorkflowParseException exception = assertThrows(WorkflowParseException.class,
                () -> parser.parseFromString("id: broken\nsteps: [first, second\n"));

        assertTrue(exception.getLineNumber() > 0);
        assertThat(exception.getMessage()).contains("YAML syntax error");
    }

    @Test
    void testSchemaErrorReportsFieldPath() {
        WorkflowParseException exception = assertThrows(WorkflowParseException.class,
                () -> parser.parseFromString(String.join("\n",
                        "id: bad-step",
                        "steps:",
                        "  - name: check",
                        "    agentType: checker",
                        "    timeout: soon")));

        assertEquals("bad-step", exception.getWorkflowId());
        assertEquals("steps[0].timeout", exception.getFieldPath());
    }

    @Test
    void testZeroMaxExecutionTimeIsRejected() {
        String document = String.join("\n",
                "id: zero",
                "maxExecutionTime: 0s",
                "steps:",
                "  - name: a",
                "    agentType: x");

        WorkflowParseException exception = assertThrows(WorkflowParseException.class,
                () -> parser.parseFromString(document));

        assertEquals("maxExecutionTime", exception.getFieldPath());
        assertThat(exception.getMessage()).contains("must be positive");
        assertFalse(parser.validateSchema(document).isValid());
    }

    @Test
    void testOutOfRangeDurationsAreParseErrors() {
        WorkflowParseException workflowLevel = assertThrows(WorkflowParseException.class,
                () -> parser.parseFromString(String.join("\n",
                        "id: huge",
                        "maxExecutionTime: 9999999999999999h",
                        "steps:",
                        "  - name: a",
                        "    agentType: x")));
        assertEquals("maxExecutionTime", workflowLevel.getFieldPath());

        WorkflowParseException stepLevel = assertThrows(WorkflowParseException.class,
                () -> parser.parseFromString(String.join("\n",
                        "id: huge",
                        "steps:",
                        "  - name: a",
                        "    agentType: x",
                        "    timeout: 9999999999999999m")));
        assertEquals("steps[0].timeout", stepLevel.getFieldPath());
    }

    @Test
    void testSchemaErrorCountsRemainingErrors() {
        WorkflowParseException exception = assertThrows(WorkflowParseException.class,
                () -> parser.parseFromString(String.join("\n",
                        "name: nameless",
                        "version: latest",
                        "steps: []")));

        assertEquals("id", exception.getFieldPath());
        assertThat(exception.getMessage()).endsWith("(and 2 more)");
    }

    @Test
    void testStructuralProblemsAreLeftToValidation() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(String.join("\n",
                "id: loop",
                "steps:",
                "  - name: a",
                "    agentType: x",
                "  - name: b",
                "    agentType: x",
                "dependencies:",
                "  a: [b]",
                "  b: [a]"));

        ValidationResult result = parser.validate(definition);

        assertTrue(result.hasError(ValidationCode.CYCLE));
        assertThrows(WorkflowValidationException.class, definition::getExecutionOrder);
    }

    @Test
    void testValidateSchemaCollectsIssues() {
        ValidationResult result = parser.validateSchema(String.join("\n",
                "id: warn",
                "owner: someone",
                "steps:",
                "  - name: a",
                "    agentType: x"));

        assertTrue(result.isValid());
        assertEquals(1, result.getWarningCount());
        assertEquals("owner", result.getWarnings().get(0).getFieldPath());

        ValidationResult unreadable = parser.validateSchema("");
        assertFalse(unreadable.isValid());
        assertTrue(unreadable.hasError(ValidationCode.SCHEMA));
    }
}

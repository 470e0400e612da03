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

import java.nio.file.Path;

/**
 * Loads {@link WorkflowDefinition}s from a declarative document.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface WorkflowDefinitionParser {

    WorkflowDefinition parse(Path file) throws WorkflowParseException;

    WorkflowDefinition parseFromString(String content) throws WorkflowParseException;

    /**
     * Validates the structural rules of a parsed definition (duplicate steps, unknown
     * references, cycles, unsatisfied inputs).
     */
    ValidationResult validate(WorkflowDefinition definition);

    /**
     * Validates the document schema before parsing.
     *
     * @param content the raw document
     * @return validation result
     */
    ValidationResult validateSchema(String content);
}

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

/**
 * Machine-readable category of a validation issue.
 */
public enum ValidationCode {
    DUPLICATE_STEP,
    UNKNOWN_STEP,
    SELF_DEPENDENCY,
    CYCLE,
    UNSATISFIED_INPUT,
    EMPTY_WORKFLOW,
    /** Warning: more than one step declares the same output. */
    DUPLICATE_OUTPUT,
    /** Warning: an optional input that no initial input or step output can supply. */
    UNSUPPLIED_OPTIONAL_INPUT,
    /** Schema-level problem in a declarative document. */
    SCHEMA
}

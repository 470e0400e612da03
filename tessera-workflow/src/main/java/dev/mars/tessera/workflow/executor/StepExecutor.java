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


package dev.mars.tessera.workflow.executor;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Performs the work of a step.
 * <p>
 * The returned future must complete with a map containing every output the step declares;
 * it may contain extra entries, which are reported in the step result but not merged into
 * the execution data. Exceptions may be thrown directly or delivered through the future.
 * <p>
 * The engine calls {@code execute} on its own invocation thread, and the step timeout covers
 * both the call and the returned future. On timeout the calling thread is interrupted and the
 * future is cancelled.
 */
@FunctionalInterface
public interface StepExecutor {

    CompletableFuture<Map<String, Object>> execute(Map<String, Object> inputs) throws Exception;
}

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Agent step loop engine.
 *
 * <p>
 * Each step asks the model for the next assistant message (think), executes the
 * tool calls it requested one by one (act), and streams every observable piece
 * of progress as an event. A session's runner repeats steps until a special
 * tool finishes the agent or the step budget is spent.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → AgentStreamController (SSE)
 * Domain Layer       → AgentRunner, StepLoop, Thinker, Actor
 * Infrastructure     → LLM / Transcript Adapters
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(EngineApplication.class, args);
    }
}

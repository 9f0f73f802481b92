package me.golemcore.engine.domain.loop;

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

import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.system.think.ThinkOutcome;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one think/act step.
 *
 * @param thinkOutcome
 *            decision of the think phase
 * @param toolResults
 *            results of the act phase in call order, empty if it did not run
 */
public record StepResult(ThinkOutcome thinkOutcome, List<ToolResult> toolResults) {

    public boolean acted() {
        return thinkOutcome.shouldAct();
    }

    public boolean replied() {
        return thinkOutcome.replied();
    }

    /**
     * Human-readable summary used by the non-streaming run.
     */
    public String summary() {
        if (!acted()) {
            return thinkOutcome.failed() ? "Thinking failed" : "Thinking complete - no action needed";
        }
        return toolResults.stream()
                .map(ToolResult::displayText)
                .collect(Collectors.joining("\n\n"));
    }
}

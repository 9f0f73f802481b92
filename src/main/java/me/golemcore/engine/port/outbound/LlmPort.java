package me.golemcore.engine.port.outbound;

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

import me.golemcore.engine.domain.model.LlmDelta;
import me.golemcore.engine.domain.model.LlmRequest;
import me.golemcore.engine.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Port for the language-model client. Turns a message list into a completion or
 * a tool-call decision, optionally streaming partial output first.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "langchain4j", "none").
     */
    String getProviderId();

    /**
     * Executes a chat completion request and returns the full response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Executes a streaming chat request. {@code onDelta} receives text fragments
     * and tool call fragments in the order the provider produces them, strictly
     * before the returned future completes. The callback may block while the
     * consumer catches up.
     *
     * <p>
     * Default implementation delegates to {@link #chat(LlmRequest)} and replays
     * the final content as a single text delta.
     */
    default CompletableFuture<LlmResponse> chatStream(LlmRequest request, Consumer<LlmDelta> onDelta) {
        return chat(request).thenApply(response -> {
            if (response.hasToolCalls()) {
                response.getToolCalls().forEach(call -> onDelta.accept(LlmDelta.toolCall(call.getName())));
            }
            if (response.hasContent()) {
                onDelta.accept(LlmDelta.text(response.getContent()));
            }
            return response;
        });
    }

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}

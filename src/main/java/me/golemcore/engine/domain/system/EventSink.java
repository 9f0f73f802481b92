package me.golemcore.engine.domain.system;

import me.golemcore.engine.domain.model.AgentEvent;

/**
 * Receives events in the order they are produced. Called from the agent's
 * driving thread only.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Sink that drops everything, used by non-streaming and silent execution.
     */
    EventSink NONE = event -> {
    };

    void emit(AgentEvent event);
}

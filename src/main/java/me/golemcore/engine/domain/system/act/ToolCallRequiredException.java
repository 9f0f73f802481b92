package me.golemcore.engine.domain.system.act;

/**
 * Protocol violation: the tool-choice policy required tool calls but the model
 * produced none. Unlike tool failures, this escapes the act phase.
 */
public class ToolCallRequiredException extends RuntimeException {

    public ToolCallRequiredException(String message) {
        super(message);
    }
}

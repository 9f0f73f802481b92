package me.golemcore.engine.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The tool call itself was malformed (missing call or blank tool name).
     */
    INVALID_REQUEST,

    /**
     * No enabled tool is registered under the requested name.
     */
    UNKNOWN_TOOL,

    /**
     * The argument payload could not be decoded into a JSON object.
     */
    INVALID_ARGUMENTS,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, interrupts).
     */
    EXECUTION_FAILED
}

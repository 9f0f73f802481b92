package me.golemcore.engine.domain.system.act;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.ToolFailureKind;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.service.ToolRegistry;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes a single tool call and normalizes every outcome into a
 * {@link ToolResult}. Never throws: unknown tools, malformed arguments and tool
 * failures all come back as error results.
 *
 * <p>
 * A special tool that completes without throwing finishes the agent,
 * regardless of what its result says.
 */
@Slf4j
public class ToolCallExecutor {

    private static final int MAX_LOG_EXCERPT = 200;
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;
    private final Duration toolTimeout;

    public ToolCallExecutor(ToolRegistry toolRegistry, ObjectMapper objectMapper, Duration toolTimeout) {
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
        this.toolTimeout = toolTimeout;
    }

    public ToolResult execute(AgentContext context, Message.ToolCall toolCall) {
        if (toolCall == null || toolCall.getName() == null || toolCall.getName().isBlank()) {
            log.warn("[Tools] Rejected malformed tool call: {}", toolCall);
            return ToolResult.failure(ToolFailureKind.INVALID_REQUEST, "Error: Invalid command format");
        }

        String name = toolCall.getName();
        if (!toolRegistry.contains(name)) {
            log.warn("[Tools] Unknown tool '{}', args: {}", name, truncate(toolCall.getArguments()));
            return ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Error: Unknown tool '" + name + "'");
        }

        Map<String, Object> arguments;
        try {
            arguments = parseArguments(toolCall.getArguments());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[Tools] Invalid arguments for '{}': {} ({})", name, truncate(toolCall.getArguments()),
                    e.getClass().getSimpleName());
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "Error parsing arguments for " + name + ": Invalid JSON format");
        }

        log.debug("[Tools] Calling '{}' (id: {})", name, toolCall.getId());
        long startMs = System.currentTimeMillis();
        ToolResult result;
        CompletableFuture<ToolResult> future = null;
        try {
            future = toolRegistry.invoke(name, arguments);
            context.setInFlightCall(future);
            result = future.get(toolTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return executionFailure(name, toolCall, "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Tools] '{}' failed, args: {}", name, truncate(toolCall.getArguments()), cause);
            return executionFailure(name, toolCall, describe(cause));
        } catch (TimeoutException e) {
            future.cancel(true);
            return executionFailure(name, toolCall, "timed out after " + toolTimeout.toMillis() + "ms");
        } catch (CancellationException e) {
            return executionFailure(name, toolCall, "cancelled");
        } catch (RuntimeException e) {
            log.error("[Tools] '{}' failed, args: {}", name, truncate(toolCall.getArguments()), e);
            return executionFailure(name, toolCall, describe(e));
        } finally {
            context.setInFlightCall(null);
        }

        if (result == null) {
            result = ToolResult.success("");
        }
        log.debug("[Tools] '{}' completed in {}ms, success={}",
                name, System.currentTimeMillis() - startMs, result.isSuccess());

        if (context.getProfile() != null && context.getProfile().isSpecialTool(name)) {
            log.info("[Tools] Special tool '{}' has completed the task", name);
            context.markFinished();
        }
        return result;
    }

    private Map<String, Object> parseArguments(String raw) throws JsonProcessingException {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        JsonNode node = objectMapper.reader()
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .readTree(raw);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Arguments must be a JSON object");
        }
        return objectMapper.convertValue(node, MAP_TYPE_REF);
    }

    private ToolResult executionFailure(String name, Message.ToolCall toolCall, String problem) {
        log.warn("[Tools] '{}' (id: {}) encountered a problem: {}, args: {}", name, toolCall.getId(), problem,
                truncate(toolCall.getArguments()));
        return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                "Tool '" + name + "' encountered a problem: " + problem);
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static String truncate(String text) {
        if (text == null) {
            return "<null>";
        }
        if (text.length() <= MAX_LOG_EXCERPT) {
            return text;
        }
        return text.substring(0, MAX_LOG_EXCERPT) + "...";
    }
}

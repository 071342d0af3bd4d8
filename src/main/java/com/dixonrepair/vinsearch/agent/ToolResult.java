package com.dixonrepair.vinsearch.agent;

import java.util.List;
import java.util.Map;

/**
 * Result from a tool execution.
 *
 * <p>Provides a structured way to return tool results to the agent,
 * including success/failure status, data, and any follow-up suggestions.
 *
 * @since 1.0.0
 */
public interface ToolResult {

    /**
     * Whether the tool executed successfully.
     */
    boolean isSuccess();

    /**
     * The primary result data. Type depends on the tool.
     */
    Object getData();

    /**
     * Human-readable message about the result.
     */
    String getMessage();

    /**
     * How the result was produced (tiers searched, cache or live, diagnostics).
     * Empty when the tool has nothing to report.
     */
    Map<String, Object> getMetadata();

    /**
     * Suggested next tools the agent might want to call.
     */
    List<String> getSuggestedNextTools();

    static ToolResult success(Object data, String message, String... suggestedNextTools) {
        return success(data, message, Map.of(), suggestedNextTools);
    }

    static ToolResult success(Object data, String message, Map<String, Object> metadata, String... suggestedNextTools) {
        return new DefaultToolResult(true, data, message, metadata, List.of(suggestedNextTools));
    }

    static ToolResult failure(String message) {
        return failure(message, null, Map.of());
    }

    /**
     * Failed result that still carries data, e.g. an engine result with a reason.
     */
    static ToolResult failure(String message, Object data, Map<String, Object> metadata) {
        return new DefaultToolResult(false, data, message, metadata, List.of());
    }
}

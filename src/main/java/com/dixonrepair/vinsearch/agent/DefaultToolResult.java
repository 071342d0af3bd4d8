package com.dixonrepair.vinsearch.agent;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable {@link ToolResult}. Metadata and suggestions are copied on the
 * way in.
 *
 * @since 1.0.0
 */
@Getter
@ToString
public class DefaultToolResult implements ToolResult {

    private final boolean success;
    private final Object data;
    private final String message;
    private final Map<String, Object> metadata;
    private final List<String> suggestedNextTools;

    DefaultToolResult(boolean success, Object data, String message,
                      Map<String, Object> metadata, List<String> suggestedNextTools) {
        this.success = success;
        this.data = data;
        this.message = message;
        // insertion order kept, null values allowed
        this.metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.suggestedNextTools = suggestedNextTools == null ? List.of() : List.copyOf(suggestedNextTools);
    }
}

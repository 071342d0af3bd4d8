package com.dixonrepair.vinsearch.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit name-to-tool dispatch.
 *
 * <p>Every {@link Tool} bean is registered under its name at startup.
 * {@link #execute} never throws: unknown tools and tool exceptions become
 * failed {@link ToolResult}s.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public ToolRegistry(List<Tool> tools) {
        for (Tool tool : tools) {
            Tool previous = this.tools.putIfAbsent(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
        }
        log.info("🧰 Registered {} tools: {}", this.tools.size(), this.tools.keySet());
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> getTools() {
        return Collections.unmodifiableCollection(tools.values());
    }

    public ToolResult execute(String name, Map<String, Object> parameters, ToolContext context) {
        Tool tool = tools.get(name);
        if (tool == null) {
            log.warn("Unknown tool requested: {}", name);
            return ToolResult.failure("Unknown tool: " + name + ". Available: " + tools.keySet());
        }

        Map<String, Object> params = parameters == null ? Map.of() : parameters;
        ToolResult result;
        try {
            result = tool.execute(params, context);
        } catch (RuntimeException e) {
            log.error("Tool {} failed", name, e);
            result = ToolResult.failure(name + " failed: " + e.getMessage());
        }

        if (context != null) {
            context.recordToolExecution(name, result.isSuccess());
        }
        log.debug("Tool {} → success={} ({})", name, result.isSuccess(), result.getMessage());
        return result;
    }
}

package com.dixonrepair.vinsearch.agent.impl;

import com.dixonrepair.vinsearch.agent.ToolContext;
import com.dixonrepair.vinsearch.model.VehicleProfile;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Default implementation of ToolContext. One instance per conversation;
 * not shared between threads.
 *
 * @since 1.0.0
 */
@Data
@Builder
public class ToolContextImpl implements ToolContext {

    private static final int MAX_HISTORY = 50;

    private String sessionId;

    private VehicleProfile vehicleProfile;

    @Builder.Default
    private List<String> executionHistory = new ArrayList<>();

    @Override
    public void recordToolExecution(String toolName, boolean success) {
        executionHistory.add(success ? toolName : toolName + ":failed");

        // Keep only last 50 executions
        if (executionHistory.size() > MAX_HISTORY) {
            executionHistory.remove(0);
        }
    }

    @Override
    public int getToolExecutionCount(String toolName) {
        return (int) executionHistory.stream()
                .filter(entry -> entry.equals(toolName) || entry.equals(toolName + ":failed"))
                .count();
    }

    public static ToolContextImpl create(String sessionId) {
        return ToolContextImpl.builder()
                .sessionId(sessionId)
                .build();
    }
}

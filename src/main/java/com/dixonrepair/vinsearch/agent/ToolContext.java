package com.dixonrepair.vinsearch.agent;

import com.dixonrepair.vinsearch.model.VehicleProfile;

import java.util.List;

/**
 * Context provided to tools during execution.
 *
 * <p>Carries what earlier tool calls in the same conversation established,
 * most importantly the resolved vehicle, so later searches can reuse it.
 *
 * @since 1.0.0
 */
public interface ToolContext {

    /**
     * Vehicle established earlier in the conversation, or null.
     */
    VehicleProfile getVehicleProfile();

    void setVehicleProfile(VehicleProfile profile);

    /**
     * Record a tool execution for history tracking.
     */
    void recordToolExecution(String toolName, boolean success);

    /**
     * Number of times a tool has been executed in this context.
     */
    int getToolExecutionCount(String toolName);

    /**
     * Tool names in execution order, most recent last.
     */
    List<String> getExecutionHistory();
}

package com.dixonrepair.vinsearch.agent;

import java.util.Map;

/**
 * Base interface for agent tools.
 *
 * <p>Tools are the capabilities a conversational agent can invoke. Each tool
 * has a clear contract: input parameters, output format, and a description
 * for the LLM to understand when to use it.
 *
 * <p>Example implementation:
 * <pre>
 * public class ResolveVehicleTool implements Tool {
 *     public String getName() { return "resolve_vehicle"; }
 *
 *     public String getDescription() {
 *         return "Decode a VIN into year, make, model, trim and engine";
 *     }
 *
 *     public ToolResult execute(Map&lt;String, Object&gt; params, ToolContext context) {
 *         String vin = (String) params.get("vin");
 *         // Resolve and return the profile
 *     }
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public interface Tool {

    /**
     * Unique name for this tool (e.g., "search_part_price").
     * Used by the LLM to invoke the tool.
     */
    String getName();

    /**
     * Human-readable description for the LLM.
     * Explains what the tool does and when to use it.
     */
    String getDescription();

    /**
     * JSON schema for the tool's parameters.
     * Used by the LLM to construct valid tool calls.
     *
     * @return JSON schema string
     */
    String getParameterSchema();

    /**
     * Execute this tool with the given parameters.
     *
     * @param parameters Input parameters from the LLM
     * @param context Execution context (current vehicle, history)
     * @return Tool execution result; never null
     */
    ToolResult execute(Map<String, Object> parameters, ToolContext context);

    /**
     * Category of this tool for organization.
     */
    ToolCategory getCategory();

    /**
     * Tool categories for organization and filtering.
     */
    enum ToolCategory {
        /**
         * Tools that identify the vehicle.
         */
        VEHICLE,

        /**
         * Tools that estimate part prices or labor time.
         */
        ESTIMATION
    }
}

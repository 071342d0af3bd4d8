package com.dixonrepair.vinsearch.agent.tools;

import com.dixonrepair.vinsearch.agent.Tool;
import com.dixonrepair.vinsearch.agent.ToolContext;
import com.dixonrepair.vinsearch.agent.ToolResult;
import com.dixonrepair.vinsearch.engine.RepairSearchEngine;
import com.dixonrepair.vinsearch.model.EngineResult;
import com.dixonrepair.vinsearch.model.LaborEstimate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Tool for estimating how long a repair takes, in minutes.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LaborTimeSearchTool implements Tool {

    private final RepairSearchEngine engine;

    @Override
    public String getName() {
        return "search_labor_time";
    }

    @Override
    public String getDescription() {
        return "Estimate the labor time of a repair from repair-cost sites. " +
               "Returns a point estimate and a range in minutes.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"description\": \"string (required) - repair description (e.g., 'front brake pad replacement')\", " +
               EstimationParameters.VEHICLE_SCHEMA + "}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ESTIMATION;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        Optional<String> description = EstimationParameters.string(parameters, "description");
        if (description.isEmpty()) {
            return ToolResult.failure("description parameter is required");
        }

        Optional<String> vin = EstimationParameters.string(parameters, "vin");
        EngineResult result = vin.isPresent()
                ? engine.searchLaborTimeForVin(vin.get(), description.get())
                : engine.searchLaborTime(description.get(), EstimationParameters.vehicle(parameters, context));

        if (context != null && result.getVehicleProfile() != null) {
            context.setVehicleProfile(result.getVehicleProfile());
        }
        if (!result.isSuccessful()) {
            return ToolResult.failure(result.getReason(), result, EstimationParameters.metadata(result));
        }

        LaborEstimate labor = result.getLaborEstimate();
        log.debug("Labor estimate for '{}': {} min", description.get(), Math.round(labor.getMinutesPoint()));
        return ToolResult.success(result, String.format("About %d minutes (%d-%d) from %d sources, %d%% confidence",
                Math.round(labor.getMinutesPoint()), Math.round(labor.getMinutesLow()), Math.round(labor.getMinutesHigh()),
                labor.getSampleCount(), result.getOverallConfidence()), EstimationParameters.metadata(result));
    }
}

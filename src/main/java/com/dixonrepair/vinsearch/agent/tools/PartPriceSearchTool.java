package com.dixonrepair.vinsearch.agent.tools;

import com.dixonrepair.vinsearch.agent.Tool;
import com.dixonrepair.vinsearch.agent.ToolContext;
import com.dixonrepair.vinsearch.agent.ToolResult;
import com.dixonrepair.vinsearch.engine.RepairSearchEngine;
import com.dixonrepair.vinsearch.model.EngineResult;
import com.dixonrepair.vinsearch.model.PriceEstimate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Tool for estimating the retail price of a part for the customer's vehicle.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class PartPriceSearchTool implements Tool {

    private final RepairSearchEngine engine;

    @Override
    public String getName() {
        return "search_part_price";
    }

    @Override
    public String getDescription() {
        return "Estimate the price range of an automotive part from online retailers. " +
               "Results are more accurate when a VIN or year/make/model is known.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"description\": \"string (required) - part description (e.g., 'front brake pads')\", " +
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
                ? engine.searchPartPriceForVin(vin.get(), description.get())
                : engine.searchPartPrice(description.get(), EstimationParameters.vehicle(parameters, context));

        if (context != null && result.getVehicleProfile() != null) {
            context.setVehicleProfile(result.getVehicleProfile());
        }
        if (!result.isSuccessful()) {
            return ToolResult.failure(result.getReason(), result, EstimationParameters.metadata(result));
        }

        PriceEstimate price = result.getPriceEstimate();
        return ToolResult.success(result, String.format("$%.2f - $%.2f (median $%.2f) from %d sources, %d%% confidence",
                price.getLow(), price.getHigh(), price.getMedian(), price.getSourceCount(), result.getOverallConfidence()),
                EstimationParameters.metadata(result), "search_labor_time");
    }
}

package com.dixonrepair.vinsearch.agent.tools;

import com.dixonrepair.vinsearch.agent.Tool;
import com.dixonrepair.vinsearch.agent.ToolContext;
import com.dixonrepair.vinsearch.agent.ToolResult;
import com.dixonrepair.vinsearch.engine.RepairSearchEngine;
import com.dixonrepair.vinsearch.exception.VehicleResolutionException;
import com.dixonrepair.vinsearch.model.VehicleProfile;
import com.dixonrepair.vinsearch.util.ExternalCallLogger;
import com.dixonrepair.vinsearch.vehicle.VinValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Tool for decoding a VIN into a vehicle profile.
 *
 * <p>Accepts either a bare VIN or free text containing one. A resolved
 * profile is stored in the tool context for later searches.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResolveVehicleTool implements Tool {

    private final RepairSearchEngine engine;

    @Override
    public String getName() {
        return "resolve_vehicle";
    }

    @Override
    public String getDescription() {
        return "Decode a 17-character VIN into year, make, model, trim and engine. " +
               "Use before price or labor searches when the customer provides a VIN.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"vin\": \"string (optional) - 17-character VIN\", " +
               "\"text\": \"string (optional) - free text that contains a VIN, used when vin is absent\"}";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.VEHICLE;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        Optional<String> vin = EstimationParameters.string(parameters, "vin")
                .or(() -> EstimationParameters.string(parameters, "text").flatMap(VinValidator::extractVin));
        if (vin.isEmpty()) {
            return ToolResult.failure("vin parameter is required (or text containing a VIN)");
        }

        try {
            VehicleProfile profile = engine.resolveVehicle(vin.get());
            if (context != null) {
                context.setVehicleProfile(profile);
            }
            return ToolResult.success(profile,
                    "Resolved " + profile.label() + (profile.isPartialDecode() ? " (partial decode)" : ""),
                    Map.of("partialDecode", profile.isPartialDecode()),
                    "search_part_price", "search_labor_time");
        } catch (VehicleResolutionException e) {
            log.info("VIN {} not resolved: {}", ExternalCallLogger.maskVin(e.getVin()), e.getMessage());
            return ToolResult.failure(e.getMessage());
        }
    }
}

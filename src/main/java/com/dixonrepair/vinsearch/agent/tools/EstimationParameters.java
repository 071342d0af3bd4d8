package com.dixonrepair.vinsearch.agent.tools;

import com.dixonrepair.vinsearch.agent.ToolContext;
import com.dixonrepair.vinsearch.model.EngineResult;
import com.dixonrepair.vinsearch.model.VehicleProfile;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parameter parsing shared by the estimation tools.
 *
 * <p>The vehicle comes from, in order: explicit year/make/model parameters,
 * then the profile stored in the context by an earlier {@code resolve_vehicle}
 * call. A {@code vin} parameter is handled by the tools themselves.
 */
final class EstimationParameters {

    static final String VEHICLE_SCHEMA =
            "\"vin\": \"string (optional) - 17-character VIN, resolved before searching\", " +
            "\"year\": \"string (optional)\", \"make\": \"string (optional)\", \"model\": \"string (optional)\", " +
            "\"trim\": \"string (optional)\", \"engine\": \"string (optional)\"";

    private EstimationParameters() {
    }

    static Optional<String> string(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    static VehicleProfile vehicle(Map<String, Object> parameters, ToolContext context) {
        Optional<String> year = string(parameters, "year");
        Optional<String> make = string(parameters, "make");
        Optional<String> model = string(parameters, "model");
        if (year.isPresent() && make.isPresent() && model.isPresent()) {
            return VehicleProfile.builder()
                    .year(year.get())
                    .make(make.get())
                    .model(model.get())
                    .trim(string(parameters, "trim").orElse(null))
                    .engine(string(parameters, "engine").orElse(null))
                    .build();
        }
        return context == null ? null : context.getVehicleProfile();
    }

    /**
     * How an engine result was produced, for the agent transcript.
     */
    static Map<String, Object> metadata(EngineResult result) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", result.getSource());
        metadata.put("finalState", result.getFinalState());
        metadata.put("overallConfidence", result.getOverallConfidence());
        metadata.put("tiersAttempted", result.getTiersAttempted());
        if (result.getDiagnostics() != null && !result.getDiagnostics().isEmpty()) {
            metadata.put("diagnostics", result.getDiagnostics());
        }
        return metadata;
    }
}

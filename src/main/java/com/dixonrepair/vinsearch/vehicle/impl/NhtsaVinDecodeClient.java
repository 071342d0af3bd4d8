package com.dixonrepair.vinsearch.vehicle.impl;

import com.dixonrepair.vinsearch.config.VinDecodeProperties;
import com.dixonrepair.vinsearch.exception.ResolutionFailedException;
import com.dixonrepair.vinsearch.model.CallContext;
import com.dixonrepair.vinsearch.model.ServiceType;
import com.dixonrepair.vinsearch.model.VehicleProfile;
import com.dixonrepair.vinsearch.util.ExternalCallLogger;
import com.dixonrepair.vinsearch.vehicle.VinDecodeClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Set;

/**
 * VIN decoding through the NHTSA vPIC API.
 *
 * <p>Calls {@code GET /api/vehicles/decodevinvalues/{vin}?format=json} and
 * reads the first entry of {@code Results}. NHTSA error code 0 is a clean
 * decode and 8 is a partial one ("no detailed data"); everything else fails.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class NhtsaVinDecodeClient implements VinDecodeClient {

    private static final String DECODE_PATH = "/api/vehicles/decodevinvalues/{vin}?format=json";
    private static final String CLEAN_DECODE = "0";
    private static final String PARTIAL_DECODE = "8";
    private static final Set<String> NHTSA_EMPTY = Set.of("", "0", "null", "Not Applicable");

    private final WebClient webClient;
    private final VinDecodeProperties props;

    public NhtsaVinDecodeClient(@Qualifier("nhtsaWebClient") WebClient webClient, VinDecodeProperties props) {
        this.webClient = webClient;
        this.props = props;
    }

    @Override
    public VehicleProfile decode(String vin) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NHTSA, "decodeVin", log);
        ctx.logRequest(ExternalCallLogger.maskVin(vin));

        JsonNode root;
        try {
            root = webClient.get()
                    .uri(DECODE_PATH, vin)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofMillis(props.getTimeoutMs()));
        } catch (WebClientResponseException e) {
            ctx.logError("HTTP " + e.getStatusCode().value(), e);
            throw new ResolutionFailedException("VIN decode service returned HTTP " + e.getStatusCode().value(), vin, e);
        } catch (RuntimeException e) {
            // block() surfaces timeouts as IllegalStateException and I/O errors as WebClientRequestException
            ctx.logError(e.getMessage(), e);
            throw new ResolutionFailedException("VIN decode service unavailable: " + e.getMessage(), vin, e);
        }

        VehicleProfile profile = parse(vin, root);
        ctx.logResponse(profile.label() + (profile.isPartialDecode() ? " (partial)" : ""));
        return profile;
    }

    VehicleProfile parse(String vin, JsonNode root) {
        if (root == null || !root.path("Results").isArray() || root.path("Results").isEmpty()) {
            throw new ResolutionFailedException("VIN decode service returned no results", vin);
        }
        JsonNode result = root.path("Results").get(0);

        String errorCode = firstErrorCode(text(result, "ErrorCode"));
        if (errorCode != null && !CLEAN_DECODE.equals(errorCode) && !PARTIAL_DECODE.equals(errorCode)) {
            String errorText = text(result, "ErrorText");
            throw new ResolutionFailedException("VIN could not be decoded: "
                    + (errorText != null ? errorText : "error code " + errorCode), vin);
        }

        String year = text(result, "ModelYear");
        String make = text(result, "Make");
        String model = text(result, "Model");
        if (year == null || make == null || model == null) {
            throw new ResolutionFailedException("VIN decode did not return year, make and model", vin);
        }

        return VehicleProfile.builder()
                .vin(vin)
                .year(year)
                .make(make)
                .model(model)
                .trim(text(result, "Trim"))
                .engine(engine(result))
                .partialDecode(PARTIAL_DECODE.equals(errorCode))
                .build();
    }

    private String engine(JsonNode result) {
        String engineModel = text(result, "EngineModel");
        if (engineModel != null) {
            return engineModel;
        }
        String configuration = text(result, "EngineConfiguration");
        String displacement = text(result, "DisplacementL");
        if (displacement != null) {
            return (configuration != null ? configuration + " " : "") + displacement + "L";
        }
        return configuration;
    }

    /**
     * NHTSA reports several codes as "8,400" style lists; the first one decides.
     */
    private static String firstErrorCode(String raw) {
        if (raw == null) {
            return null;
        }
        return raw.split(",")[0].trim();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return NHTSA_EMPTY.contains(text) && !"ErrorCode".equals(field) ? null : text;
    }
}

package com.dixonrepair.vinsearch.engine;

import com.dixonrepair.vinsearch.exception.InvalidVinException;
import com.dixonrepair.vinsearch.exception.ResolutionFailedException;
import com.dixonrepair.vinsearch.model.EngineResult;
import com.dixonrepair.vinsearch.model.VehicleProfile;

import java.time.Duration;

/**
 * Entry point for VIN-aware part price and labor time lookups.
 *
 * <p><b>Guarantees:</b>
 * <ul>
 *   <li>The search operations never throw; failures come back as an
 *       {@link EngineResult} with confidence 0 and a reason</li>
 *   <li>Every result carries an explicit overall confidence</li>
 *   <li>Results cut short by the deadline are discounted and never cached</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Implementations are thread-safe; concurrent
 * requests share only the cache.
 *
 * @since 1.0.0
 */
public interface RepairSearchEngine {

    /**
     * @throws InvalidVinException       when the VIN is malformed
     * @throws ResolutionFailedException when the decode service cannot resolve it
     */
    VehicleProfile resolveVehicle(String vin);

    /**
     * @param description part description, e.g. "brake pads"
     * @param profile     vehicle, may be null
     */
    EngineResult searchPartPrice(String description, VehicleProfile profile);

    EngineResult searchPartPrice(String description, VehicleProfile profile, Duration deadline);

    /**
     * @param description repair description, e.g. "front brake pad replacement"
     * @param profile     vehicle, may be null
     */
    EngineResult searchLaborTime(String description, VehicleProfile profile);

    EngineResult searchLaborTime(String description, VehicleProfile profile, Duration deadline);

    /**
     * Resolves the VIN first and falls back to a generic search when it is
     * invalid or cannot be resolved. The skipped resolution is recorded in
     * the result diagnostics.
     */
    EngineResult searchPartPriceForVin(String vin, String description);

    /**
     * @param deadline covers resolution and search; time spent resolving is
     *                 taken off the search deadline
     */
    EngineResult searchPartPriceForVin(String vin, String description, Duration deadline);

    /**
     * Labor counterpart of {@link #searchPartPriceForVin}.
     */
    EngineResult searchLaborTimeForVin(String vin, String description);

    EngineResult searchLaborTimeForVin(String vin, String description, Duration deadline);
}

package com.dixonrepair.vinsearch.vehicle;

import com.dixonrepair.vinsearch.exception.ResolutionFailedException;
import com.dixonrepair.vinsearch.model.VehicleProfile;

/**
 * Remote VIN decode service.
 *
 * @since 1.0.0
 */
public interface VinDecodeClient {

    /**
     * Decodes a VIN that already passed format validation.
     *
     * @param vin normalized 17-character VIN
     * @return decoded profile carrying the VIN
     * @throws ResolutionFailedException on any service, HTTP or timeout error,
     *                                   or when make, model or year is missing
     */
    VehicleProfile decode(String vin);
}

package com.dixonrepair.vinsearch.vehicle;

import com.dixonrepair.vinsearch.exception.InvalidVinException;
import com.dixonrepair.vinsearch.exception.ResolutionFailedException;
import com.dixonrepair.vinsearch.model.VehicleProfile;

/**
 * Turns a VIN into a {@link VehicleProfile}.
 *
 * <p>Format validation runs first and never touches the network or the
 * cache. Valid VINs are served from the {@code vehicle_decode} cache when
 * possible; fresh decodes are cached before they are returned.
 *
 * @since 1.0.0
 */
public interface VehicleProfileResolver {

    /**
     * @throws InvalidVinException       when the VIN is malformed
     * @throws ResolutionFailedException when the decode service cannot resolve it
     */
    VehicleProfile resolve(String vin);
}

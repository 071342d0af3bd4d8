package com.dixonrepair.vinsearch.exception;

import lombok.Getter;

/**
 * Base class for failures turning a VIN into a vehicle profile.
 */
@Getter
public abstract class VehicleResolutionException extends RuntimeException {

    private final String vin;

    protected VehicleResolutionException(String message, String vin) {
        super(message);
        this.vin = vin;
    }

    protected VehicleResolutionException(String message, String vin, Throwable cause) {
        super(message, cause);
        this.vin = vin;
    }
}

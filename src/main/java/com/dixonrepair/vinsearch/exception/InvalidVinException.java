package com.dixonrepair.vinsearch.exception;

/**
 * VIN is malformed. Raised before any network call or cache access and never retried.
 */
public class InvalidVinException extends VehicleResolutionException {

    public InvalidVinException(String message, String vin) {
        super(message, vin);
    }
}

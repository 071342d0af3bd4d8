package com.dixonrepair.vinsearch.exception;

/**
 * VIN is well formed but the decode service could not resolve it. Callers
 * fall back to less specific queries instead of failing the request.
 */
public class ResolutionFailedException extends VehicleResolutionException {

    public ResolutionFailedException(String message, String vin) {
        super(message, vin);
    }

    public ResolutionFailedException(String message, String vin, Throwable cause) {
        super(message, vin, cause);
    }
}

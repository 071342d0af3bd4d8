package com.dixonrepair.vinsearch.util;

import com.dixonrepair.vinsearch.model.CallContext;
import com.dixonrepair.vinsearch.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging utility for all external service calls (search providers, NHTSA).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (to avoid log spam)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * VINs are logged with the serial part masked.
     */
    public static String maskVin(String vin) {
        if (vin == null || vin.length() < 8) {
            return "(invalid)";
        }
        return vin.substring(0, 8) + "*".repeat(vin.length() - 8);
    }
}

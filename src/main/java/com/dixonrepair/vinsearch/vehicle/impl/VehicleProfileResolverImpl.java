package com.dixonrepair.vinsearch.vehicle.impl;

import com.dixonrepair.vinsearch.cache.SearchCacheManager;
import com.dixonrepair.vinsearch.config.VinDecodeProperties;
import com.dixonrepair.vinsearch.exception.InvalidVinException;
import com.dixonrepair.vinsearch.model.CacheType;
import com.dixonrepair.vinsearch.model.VehicleProfile;
import com.dixonrepair.vinsearch.util.ExternalCallLogger;
import com.dixonrepair.vinsearch.vehicle.VehicleProfileResolver;
import com.dixonrepair.vinsearch.vehicle.VinDecodeClient;
import com.dixonrepair.vinsearch.vehicle.VinValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class VehicleProfileResolverImpl implements VehicleProfileResolver {

    private final VinDecodeClient decodeClient;
    private final SearchCacheManager cache;
    private final VinDecodeProperties props;

    @Override
    public VehicleProfile resolve(String vin) {
        String normalized = VinValidator.normalize(vin);
        if (!VinValidator.isValidFormat(normalized)
                || (props.isEnforceCheckDigit() && !VinValidator.hasValidCheckDigit(normalized))) {
            throw new InvalidVinException(VinValidator.describeProblem(normalized), vin);
        }

        Optional<VehicleProfile> cached = cache.get(normalized, CacheType.VEHICLE_DECODE, VehicleProfile.class);
        if (cached.isPresent()) {
            log.debug("Vehicle profile for {} served from cache", ExternalCallLogger.maskVin(normalized));
            return cached.get();
        }

        VehicleProfile profile = decodeClient.decode(normalized);
        cache.put(normalized, CacheType.VEHICLE_DECODE, profile);
        log.info("🚗 Resolved {} → {}", ExternalCallLogger.maskVin(normalized), profile.label());
        return profile;
    }
}

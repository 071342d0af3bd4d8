package com.dixonrepair.vinsearch.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Configuration class that enables all @ConfigurationProperties classes.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link GlobalRetryConfig} - Retry and backoff for provider calls
 *   <li>{@link SearchProperties} - Search providers and tier escalation
 *   <li>{@link ValidationProperties} - Result scoring and sanity bounds
 *   <li>{@link EngineProperties} - Confidence constants and deadlines
 *   <li>{@link VinDecodeProperties} - NHTSA decode service
 *   <li>{@link CacheProperties} - Cache sizing
 *   <li>{@link ExecutorProperties} - Provider call thread pool
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    GlobalRetryConfig.class,
    SearchProperties.class,
    ValidationProperties.class,
    EngineProperties.class,
    VinDecodeProperties.class,
    CacheProperties.class,
    ExecutorProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
    // Spring instantiates and binds the classes listed above.
}

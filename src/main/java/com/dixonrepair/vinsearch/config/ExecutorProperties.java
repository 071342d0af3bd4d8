package com.dixonrepair.vinsearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Thread pool backing concurrent provider calls, loaded from {@code app.executor}.
 */
@ConfigurationProperties(prefix = "app.executor")
@Data
public class ExecutorProperties {
    private int corePoolSize = 8;
    private int maxPoolSize = 32;
    private int queueCapacity = 200;
    private int awaitTerminationSeconds = 30;
}

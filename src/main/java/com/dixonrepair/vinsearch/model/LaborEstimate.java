package com.dixonrepair.vinsearch.model;

import lombok.Builder;
import lombok.Value;

/**
 * Labor time combined across sources, in minutes.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class LaborEstimate {
    double minutesPoint;
    double minutesLow;
    double minutesHigh;
    int confidence;
    int sampleCount;
}

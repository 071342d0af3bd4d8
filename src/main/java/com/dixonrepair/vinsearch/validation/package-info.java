/**
 * Result validation: extraction, page classification, trust, quality
 * scoring and cross-source price anomaly detection.
 *
 * @since 1.0.0
 */
package com.dixonrepair.vinsearch.validation;

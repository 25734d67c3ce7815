/**
 * Configuration loading and validation for the detector thresholds.
 *
 * <p>
 * Thresholds are defined in YAML and loaded by
 * {@link com.cellsentinel.core.config.ThresholdsLoader} into a
 * {@link com.cellsentinel.core.config.DetectorThresholds} instance.
 * Validation is performed automatically after parsing to ensure fail-fast
 * behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.cellsentinel.core.config;

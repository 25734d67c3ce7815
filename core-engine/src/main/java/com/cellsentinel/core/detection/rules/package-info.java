/**
 * Built-in cell detectors, one class per {@link com.cellsentinel.core.model.FlagType}.
 *
 * <p>
 * Every detector reads its limits from
 * {@link com.cellsentinel.core.config.DetectorThresholds} at construction
 * time and is stateless afterwards. Instances are created through
 * {@link com.cellsentinel.core.detection.DetectorRegistry}.
 * </p>
 */
package com.cellsentinel.core.detection.rules;

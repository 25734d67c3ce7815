/**
 * Cell flagging engine.
 *
 * <p>
 * All detectors implement the
 * {@link com.cellsentinel.core.detection.CellDetector} interface and are
 * instantiated via {@link com.cellsentinel.core.detection.DetectorRegistry}.
 * {@link com.cellsentinel.core.detection.FlagAggregator} runs them over one
 * {@link com.cellsentinel.core.detection.DetectionContext} per cell and sorts
 * the combined output.
 * </p>
 *
 * <h3>Sibling context</h3>
 * <p>
 * The first-discharge outlier check compares a cell with the other cells of
 * its experiment, supplied as a
 * {@link com.cellsentinel.core.detection.SiblingPopulation}. Every other
 * detector looks at the cell alone.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new flag, add a {@code FlagType} constant, implement
 * {@code CellDetector} in the {@code rules} package and map the type in
 * {@code DetectorRegistry.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.cellsentinel.core.detection;

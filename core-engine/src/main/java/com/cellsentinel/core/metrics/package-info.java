/**
 * Metric extractors: pure functions deriving retention, efficiency
 * statistics, degradation rates, z-scores and completeness figures from a
 * cell series.
 *
 * @since 1.0.0
 */
package com.cellsentinel.core.metrics;

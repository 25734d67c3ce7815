/**
 * Experiment-level roll-ups of per-cell flag sets.
 *
 * @since 1.0.0
 */
package com.cellsentinel.core.summary;

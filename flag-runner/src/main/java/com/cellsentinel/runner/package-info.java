/**
 * Batch runner that flags every cell of an experiment document.
 *
 * <p>
 * Entry point: {@link com.cellsentinel.runner.CellFlagsJob}. Input and
 * output are JSON documents handled with Jackson; configuration comes from
 * environment variables via {@link com.cellsentinel.runner.RunnerConfig}.
 * </p>
 *
 * @since 1.0.0
 */
package com.cellsentinel.runner;

/**
 * Domain model classes for Cell Sentinel.
 *
 * <p>
 * This package contains the immutable value types exchanged between the
 * ingestion side, the detection engine and the display side:
 * </p>
 * <ul>
 * <li>{@link com.cellsentinel.core.model.CellSeries}: validated cycling
 * history of one cell, made of
 * {@link com.cellsentinel.core.model.CycleRecord} rows</li>
 * <li>{@link com.cellsentinel.core.model.Flag}: single detector finding</li>
 * <li>{@link com.cellsentinel.core.model.FlagSet}: sorted flags of one cell
 * with their {@link com.cellsentinel.core.model.FlagSummary}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.cellsentinel.core.model;

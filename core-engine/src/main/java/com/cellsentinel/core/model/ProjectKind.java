package com.cellsentinel.core.model;

import java.util.Locale;

/**
 * Kind of project a cell belongs to.
 *
 * <p>
 * Determines how coulombic efficiency is read: in an anode half-cell the
 * lithiation step is recorded as discharge, so reversibility is charge over
 * discharge rather than the supplied ratio.
 * </p>
 *
 * @since 1.0.0
 */
public enum ProjectKind {

    FULL_CELL("Full Cell"),
    CATHODE("Cathode"),
    ANODE("Anode");

    private final String displayName;

    ProjectKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve a project kind from either its constant name or its display name
     * ({@code "Full Cell"}, {@code "full_cell"}, {@code "ANODE"} ...).
     *
     * @param value textual project kind; {@code null} or blank yields
     *              {@link #FULL_CELL}
     * @return the matching kind
     * @throws IllegalArgumentException if the value matches no kind
     */
    public static ProjectKind parse(String value) {
        if (value == null || value.isBlank()) {
            return FULL_CELL;
        }
        String normalised = value.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (ProjectKind kind : values()) {
            if (kind.name().equals(normalised)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown project kind: '" + value
                + "'. Supported: Full Cell, Cathode, Anode");
    }
}

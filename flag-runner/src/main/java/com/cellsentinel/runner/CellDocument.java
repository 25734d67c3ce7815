package com.cellsentinel.runner;

import com.cellsentinel.core.model.CellSeries;
import com.cellsentinel.core.model.InvalidSeriesException;
import com.cellsentinel.core.model.ProjectKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of one cell in an experiment input document.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CellDocument {

    private String cellId;
    private Double loadingMg;
    private Double activeMaterialPercent;
    private String projectKind;
    private Integer formationCycles;
    private List<CycleDocument> cycles = new ArrayList<>();

    public CellDocument() {
    }

    /**
     * Convert to a validated series.
     *
     * @return the cell series
     * @throws InvalidSeriesException   if the rows violate series invariants
     * @throws IllegalArgumentException if the project kind is unknown
     * @throws IllegalStateException    if a cycle entry is null
     */
    public CellSeries toSeries() {
        CellSeries.Builder builder = CellSeries.builder(cellId)
                .loadingMg(loadingMg)
                .activeMaterialPercent(activeMaterialPercent)
                .projectKind(ProjectKind.parse(projectKind));
        if (formationCycles != null) {
            builder.formationCycleCount(formationCycles);
        }
        if (cycles != null) {
            for (CycleDocument c : cycles) {
                if (c == null) {
                    throw new IllegalStateException(
                            "Malformed experiment document: null cycle entry in cell '" + cellId + "'");
                }
                builder.addRecord(c.toRecord());
            }
        }
        return builder.build();
    }

    public String getCellId() {
        return cellId;
    }

    public void setCellId(String cellId) {
        this.cellId = cellId;
    }

    public Double getLoadingMg() {
        return loadingMg;
    }

    public void setLoadingMg(Double loadingMg) {
        this.loadingMg = loadingMg;
    }

    public Double getActiveMaterialPercent() {
        return activeMaterialPercent;
    }

    public void setActiveMaterialPercent(Double activeMaterialPercent) {
        this.activeMaterialPercent = activeMaterialPercent;
    }

    public String getProjectKind() {
        return projectKind;
    }

    public void setProjectKind(String projectKind) {
        this.projectKind = projectKind;
    }

    public Integer getFormationCycles() {
        return formationCycles;
    }

    public void setFormationCycles(Integer formationCycles) {
        this.formationCycles = formationCycles;
    }

    public List<CycleDocument> getCycles() {
        return cycles;
    }

    public void setCycles(List<CycleDocument> cycles) {
        this.cycles = cycles;
    }
}

package com.cellsentinel.runner;

import com.cellsentinel.core.model.FlagSet;
import com.cellsentinel.core.model.Severity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of one cell's flags in the output document.
 *
 * @since 1.0.0
 */
public class CellFlagsDocument {

    private final String cellId;
    private final String label;
    private final Map<String, Integer> counts;
    private final List<FlagDocument> flags;

    CellFlagsDocument(FlagSet flagSet) {
        this.cellId = flagSet.getCellIdentifier();
        this.label = flagSet.getSummary().compactLabel();
        this.counts = new LinkedHashMap<>();
        for (Map.Entry<Severity, Integer> e : flagSet.getSummary().getCounts().entrySet()) {
            counts.put(e.getKey().name(), e.getValue());
        }
        this.flags = flagSet.getFlags().stream().map(FlagDocument::new).toList();
    }

    public String getCellId() {
        return cellId;
    }

    public String getLabel() {
        return label;
    }

    public Map<String, Integer> getCounts() {
        return counts;
    }

    public List<FlagDocument> getFlags() {
        return flags;
    }
}

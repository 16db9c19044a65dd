package org.iceforge.strata.semantic.compiler;

import org.iceforge.strata.semantic.model.DimensionDefinition;

/**
 * A requested dimension. {@code grain} is null when no date truncation was asked for.
 */
public record ResolvedDimension(String requestedName, String baseName, DateGrain grain,
                                DimensionDefinition definition) {

    public String table() {
        return definition.getTable();
    }

    /**
     * Alias used in SELECT: the suffixed name for truncated dimensions, otherwise the base name.
     */
    public String alias() {
        return grain == null ? baseName : requestedName;
    }
}

package org.iceforge.strata.semantic.compiler;

/**
 * Date truncation grains that may be requested by suffixing a dimension name,
 * e.g. {@code ordered_date__month}.
 */
public enum DateGrain {
    WEEK("__week"),
    MONTH("__month"),
    YEAR("__year");

    private final String suffix;

    DateGrain(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * Splits a requested name into its base name and optional grain. Only a trailing suffix is stripped.
     */
    public static GrainedName parse(String name) {
        if (name == null) {
            return new GrainedName(null, null, null);
        }
        for (DateGrain grain : values()) {
            if (name.endsWith(grain.suffix)) {
                return new GrainedName(name, name.substring(0, name.length() - grain.suffix.length()), grain);
            }
        }
        return new GrainedName(name, name, null);
    }

    public record GrainedName(String requested, String base, DateGrain grain) {
        public boolean hasGrain() {
            return grain != null;
        }
    }
}

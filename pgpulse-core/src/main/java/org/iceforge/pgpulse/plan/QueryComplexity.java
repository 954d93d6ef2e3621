package org.iceforge.pgpulse.plan;

import com.fasterxml.jackson.annotation.JsonValue;

/** Coarse complexity class derived from plan node types. Ordered from cheapest to most expensive. */
public enum QueryComplexity {
    SIMPLE("Simple"),
    MODERATE("Moderate"),
    COMPLEX("Complex");

    private final String label;

    QueryComplexity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** The more complex of this and {@code other}; complexity never goes down. */
    public QueryComplexity atLeast(QueryComplexity other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}

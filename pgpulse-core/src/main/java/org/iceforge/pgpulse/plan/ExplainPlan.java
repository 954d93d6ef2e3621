package org.iceforge.pgpulse.plan;

import java.util.Objects;

/**
 * A parsed {@code EXPLAIN (FORMAT JSON)} document: the root plan node plus the top-level timing
 * fields when the server reported them.
 */
public record ExplainPlan(PlanNode root, Double planningTime, Double executionTime) {
    public ExplainPlan {
        Objects.requireNonNull(root, "root");
    }
}

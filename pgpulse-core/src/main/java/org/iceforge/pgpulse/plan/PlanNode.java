package org.iceforge.pgpulse.plan;

import java.util.List;

/**
 * One node of a PostgreSQL execution plan ({@code "Node Type"}, {@code "Relation Name"},
 * {@code "Index Name"}, {@code "Plans"}).
 */
public record PlanNode(
        String nodeType,
        String relationName,
        String indexName,
        List<PlanNode> plans
) {
    public PlanNode {
        plans = plans == null ? List.of() : List.copyOf(plans);
    }

    public static PlanNode leaf(String nodeType, String relationName, String indexName) {
        return new PlanNode(nodeType, relationName, indexName, List.of());
    }

    public static PlanNode of(String nodeType, PlanNode... children) {
        return new PlanNode(nodeType, null, null, List.of(children));
    }
}

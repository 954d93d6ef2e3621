package org.iceforge.pgpulse.plan;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies a query plan without touching the database.
 * <p>
 * Walks the tree in pre-order. Per node:
 * <ul>
 *   <li>type containing "Join", "Aggregate" or "Sort": at least Moderate</li>
 *   <li>"Nested Loop", "Hash Join", "Merge Join": Complex</li>
 *   <li>"Index Scan" / "Index Only Scan": record index, table is {@code index_scan}</li>
 *   <li>"Bitmap Index Scan": record index, at least Moderate</li>
 *   <li>"Bitmap Heap Scan": table is {@code bitmap_scan}</li>
 *   <li>"Seq Scan": table is {@code seq_scan}, at least Moderate</li>
 * </ul>
 * Complexity only ever escalates. Stateless and thread-safe.
 */
public final class PlanAnalyzer {

    private static final Set<String> COMPLEX_JOINS = Set.of("Nested Loop", "Hash Join", "Merge Join");

    public PlanAnalysis analyze(ExplainPlan plan) {
        Objects.requireNonNull(plan, "plan");
        return analyze(plan.root(), plan.planningTime());
    }

    public PlanAnalysis analyze(PlanNode root) {
        return analyze(root, null);
    }

    private PlanAnalysis analyze(PlanNode root, Double planningTime) {
        Objects.requireNonNull(root, "root");

        QueryComplexity complexity = QueryComplexity.SIMPLE;
        Set<String> indexes = new LinkedHashSet<>();
        Map<String, ScanType> scans = new LinkedHashMap<>();

        Deque<PlanNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            PlanNode node = stack.pop();
            complexity = visit(node, complexity, indexes, scans);

            List<PlanNode> children = node.plans();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return new PlanAnalysis(complexity, indexes, scans, planningTime);
    }

    private static QueryComplexity visit(PlanNode node, QueryComplexity current,
                                         Set<String> indexes, Map<String, ScanType> scans) {
        String type = node.nodeType();
        if (type == null) {
            return current;
        }
        QueryComplexity c = current;

        if (type.contains("Join") || type.contains("Aggregate") || type.contains("Sort")) {
            c = c.atLeast(QueryComplexity.MODERATE);
        }
        if (COMPLEX_JOINS.contains(type)) {
            c = QueryComplexity.COMPLEX;
        }

        switch (type) {
            case "Index Scan", "Index Only Scan" -> {
                addIfPresent(indexes, node.indexName());
                putIfPresent(scans, node.relationName(), ScanType.INDEX_SCAN);
            }
            case "Bitmap Index Scan" -> {
                addIfPresent(indexes, node.indexName());
                c = c.atLeast(QueryComplexity.MODERATE);
            }
            case "Bitmap Heap Scan" -> putIfPresent(scans, node.relationName(), ScanType.BITMAP_SCAN);
            case "Seq Scan" -> {
                putIfPresent(scans, node.relationName(), ScanType.SEQ_SCAN);
                c = c.atLeast(QueryComplexity.MODERATE);
            }
            default -> {
            }
        }
        return c;
    }

    private static void addIfPresent(Set<String> indexes, String name) {
        if (name != null && !name.isBlank()) {
            indexes.add(name);
        }
    }

    private static void putIfPresent(Map<String, ScanType> scans, String relation, ScanType type) {
        if (relation != null && !relation.isBlank()) {
            scans.put(relation, type);
        }
    }
}

package org.iceforge.pgpulse.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads PostgreSQL {@code EXPLAIN (FORMAT JSON)} output into {@link ExplainPlan}.
 * <p>
 * Accepts the driver's raw column text, which is a one-element JSON array
 * ({@code [{"Plan": {...}, "Planning Time": 0.1}]}), or the bare top-level object.
 */
public final class PlanParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PlanParser() {}

    public static ExplainPlan parse(String explainJson) {
        if (explainJson == null || explainJson.isBlank()) {
            throw new PlanAnalysisException("EXPLAIN returned no plan");
        }
        try {
            return fromJson(MAPPER.readTree(explainJson));
        } catch (JsonProcessingException e) {
            throw new PlanAnalysisException("EXPLAIN output is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static ExplainPlan fromJson(JsonNode doc) {
        JsonNode top = doc;
        if (top != null && top.isArray()) {
            top = top.size() > 0 ? top.get(0) : null;
        }
        if (top == null || !top.isObject()) {
            throw new PlanAnalysisException("EXPLAIN output has no plan document");
        }
        JsonNode plan = top.get("Plan");
        if (plan == null || !plan.isObject()) {
            throw new PlanAnalysisException("EXPLAIN output has no \"Plan\" node");
        }
        return new ExplainPlan(node(plan), number(top, "Planning Time"), number(top, "Execution Time"));
    }

    private static PlanNode node(JsonNode n) {
        List<PlanNode> children = new ArrayList<>();
        JsonNode plans = n.get("Plans");
        if (plans != null && plans.isArray()) {
            for (JsonNode child : plans) {
                if (child.isObject()) {
                    children.add(node(child));
                }
            }
        }
        return new PlanNode(text(n, "Node Type"), text(n, "Relation Name"), text(n, "Index Name"), children);
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }

    private static Double number(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return (v == null || !v.isNumber()) ? null : v.asDouble();
    }
}

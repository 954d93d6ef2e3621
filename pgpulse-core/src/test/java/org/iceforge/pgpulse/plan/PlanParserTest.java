package org.iceforge.pgpulse.plan;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanParserTest {

    private static final String EXPLAIN_JSON = """
            [
              {
                "Plan": {
                  "Node Type": "Nested Loop",
                  "Plans": [
                    {"Node Type": "Seq Scan", "Relation Name": "orders", "Alias": "o"},
                    {"Node Type": "Index Scan", "Relation Name": "customers", "Index Name": "customers_pkey"}
                  ]
                },
                "Planning Time": 0.123,
                "Execution Time": 4.5
              }
            ]
            """;

    @Test
    void parsesDriverOutput() {
        ExplainPlan plan = PlanParser.parse(EXPLAIN_JSON);

        assertThat(plan.planningTime()).isEqualTo(0.123);
        assertThat(plan.executionTime()).isEqualTo(4.5);
        assertThat(plan.root().nodeType()).isEqualTo("Nested Loop");
        assertThat(plan.root().plans()).extracting(PlanNode::relationName).containsExactly("orders", "customers");
        assertThat(plan.root().plans().get(1).indexName()).isEqualTo("customers_pkey");
    }

    @Test
    void planningTimeIsOptional() {
        ExplainPlan plan = PlanParser.parse("{\"Plan\": {\"Node Type\": \"Result\"}}");

        assertThat(plan.planningTime()).isNull();
        assertThat(plan.root().plans()).isEmpty();
    }

    @Test
    void rejectsMalformedOutput() {
        assertThatThrownBy(() -> PlanParser.parse("not json")).isInstanceOf(PlanAnalysisException.class);
        assertThatThrownBy(() -> PlanParser.parse("[]")).isInstanceOf(PlanAnalysisException.class);
        assertThatThrownBy(() -> PlanParser.parse("[{\"Planning Time\": 1}]")).isInstanceOf(PlanAnalysisException.class);
        assertThatThrownBy(() -> PlanParser.parse(null)).isInstanceOf(PlanAnalysisException.class);
    }
}

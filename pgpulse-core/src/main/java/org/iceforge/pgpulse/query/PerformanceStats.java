package org.iceforge.pgpulse.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.iceforge.pgpulse.plan.PlanAnalysis;
import org.iceforge.pgpulse.plan.QueryComplexity;
import org.iceforge.pgpulse.plan.ScanType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Timings in milliseconds. Plan-derived fields are {@code null} when the plan could not be
 * collected.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PerformanceStats(
        double executionTime,
        double connectionTime,
        Double queryPlanningTime,
        Double queryExecutionTime,
        long bytesReceived,
        int rowsReturned,
        Integer rowsAffected,
        QueryComplexity queryComplexity,
        Set<String> indexesUsed,
        Map<String, ScanType> tablesScanStatus
) {
    public PerformanceStats {
        indexesUsed = indexesUsed == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(indexesUsed));
        tablesScanStatus = tablesScanStatus == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(tablesScanStatus));
    }

    PerformanceStats withPlan(PlanAnalysis plan) {
        return new PerformanceStats(executionTime, connectionTime, plan.planningTime(), queryExecutionTime,
                bytesReceived, rowsReturned, rowsAffected,
                plan.complexity(), plan.indexesUsed(), plan.tablesScanStatus());
    }
}

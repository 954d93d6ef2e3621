package org.iceforge.pgpulse.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** Result of {@link PlanAnalyzer}: index usage and per-table scan types. */
public record PlanAnalysis(
        QueryComplexity complexity,
        Set<String> indexesUsed,
        Map<String, ScanType> tablesScanStatus,
        Double planningTime
) {
    public PlanAnalysis {
        indexesUsed = Collections.unmodifiableSet(new LinkedHashSet<>(indexesUsed));
        tablesScanStatus = Collections.unmodifiableMap(new LinkedHashMap<>(tablesScanStatus));
    }
}

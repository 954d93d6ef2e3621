package org.iceforge.pgpulse.plan;

import com.fasterxml.jackson.annotation.JsonValue;

/** How a table is read by the plan. */
public enum ScanType {
    SEQ_SCAN("seq_scan"),
    INDEX_SCAN("index_scan"),
    BITMAP_SCAN("bitmap_scan");

    private final String label;

    ScanType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}

package com.migratorx.cli.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;

/**
 * JSON shape written to stdout.
 *
 * <pre>
 * {"summary": {"info": 1, "warn": 0, "block": 0},
 *  "findings": [{"severity": "INFO", "message": "...", "meta": {...}}]}
 * </pre>
 */
@JsonPropertyOrder({"summary", "findings"})
record ReportDocument(SummaryView summary, List<FindingView> findings) {

    @JsonPropertyOrder({"info", "warn", "block"})
    record SummaryView(int info, int warn, int block) {
    }

    @JsonPropertyOrder({"severity", "message", "meta"})
    record FindingView(
            String severity,
            String message,
            @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> meta) {
    }
}

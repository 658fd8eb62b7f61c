package com.zzf.optrace.trace.view;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * One row of {@code information_schema.OPTIMIZER_TRACE}.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class OptimizerTraceRow {
    @JsonProperty("QUERY")
    private String query;
    @JsonProperty("TRACE")
    private String trace;
    @JsonProperty("MISSING_BYTES_BEYOND_MAX_MEM_SIZE")
    private long missingBytesBeyondMaxMemSize;
    @JsonProperty("INSUFFICIENT_PRIVILEGES")
    private boolean insufficientPrivileges;

    /** Same row with the statement and trace blanked, for readers lacking privileges. */
    public OptimizerTraceRow redacted() {
        return toBuilder().query("").trace("").build();
    }
}

package com.owldoor.geocoder.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Progress marker stored next to the output file as {@code <output>.checkpoint}.
 *
 * Every row with index <= lastCompletedIndex is already in the output; a resumed run
 * starts at lastCompletedIndex + 1. A value of -1 means nothing has been committed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Checkpoint {

    @JsonProperty("last_completed_index")
    private long lastCompletedIndex;

    /** Null when the checkpoint was inferred from an output without a sidecar. */
    @JsonProperty("chunk_size")
    private Integer chunkSize;

    @JsonProperty("provider_id")
    private String providerId;

    /** Data rows in the output file at commit time (header excluded). */
    @JsonProperty("rows_written")
    private long rowsWritten;

    @JsonProperty("updated_at")
    private String updatedAt;

    public long nextIndex() {
        return lastCompletedIndex + 1;
    }
}

package com.incoresoft.blePresence.domain.registry.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A fixed receiver ("device") as stored under {@code devices} in the data file.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReceiverDto {
    @JsonProperty("name")
    private String name;
    @JsonProperty("type")
    private String type;
    /** Epoch millis of the last ingested report. */
    @JsonProperty("update")
    private Long update;
    @JsonProperty("batch")
    private Integer batch;
    @JsonProperty("total_batches")
    private Integer totalBatches;

    public ReceiverDto copy() {
        return toBuilder().build();
    }
}

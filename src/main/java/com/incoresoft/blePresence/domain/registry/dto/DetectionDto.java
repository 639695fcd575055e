package com.incoresoft.blePresence.domain.registry.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Latest observation of one beacon by one receiver.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectionDto {
    @JsonProperty("receiver_name")
    private String receiverName;
    /** Older producers wrote the receiver name under this key. */
    @JsonProperty("receiver")
    private String receiver;
    @JsonProperty("rssi")
    private Integer rssi;
    @JsonProperty("online")
    private Boolean online;
    @JsonProperty("update_time")
    private Long updateTime;
    /** Legacy local time string, e.g. "2025/11/7 20:32:24". */
    @JsonProperty("last_update")
    private String lastUpdate;

    public String displayReceiverName() {
        return receiverName != null ? receiverName : receiver;
    }

    public boolean reportedOnline() {
        return Boolean.TRUE.equals(online);
    }

    public DetectionDto copy() {
        return toBuilder().build();
    }
}

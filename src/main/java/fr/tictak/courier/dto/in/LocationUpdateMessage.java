package fr.tictak.courier.dto.in;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Required fields of a live position report sent by an agent device. Other fields are
 * ignored here and relayed untouched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LocationUpdateMessage(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("order_id") String orderId,
        @JsonProperty("lat") Double lat,
        @JsonProperty("lng") Double lng
) {

    public boolean isWellFormed() {
        return agentId != null && !agentId.isBlank()
                && orderId != null && !orderId.isBlank()
                && lat != null && lat >= -90.0 && lat <= 90.0
                && lng != null && lng >= -180.0 && lng <= 180.0;
    }
}

package fr.tictak.courier.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "location_history")
@CompoundIndex(name = "agent_order_timestamp", def = "{'agent_id': 1, 'order_id': 1, 'timestamp': 1}")
public class LocationSample {

    @Id
    private String id;

    @Field("agent_id")
    private String agentId;

    @Field("order_id")
    private String orderId;

    private double lat;
    private double lng;

    // Assigned by the server at ingestion
    private Instant timestamp;

    public static LocationSample of(String agentId, String orderId, double lat, double lng, Instant timestamp) {
        return new LocationSample(null, agentId, orderId, lat, lng, timestamp);
    }
}

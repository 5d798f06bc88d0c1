package fr.tictak.courier.model;

import fr.tictak.courier.model.enums.OrderStatus;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * A delivery task. {@code startedAt} is set exactly when the order has left {@code PENDING};
 * {@code completedAt} exactly when it is {@code COMPLETED}. Both are only written through
 * {@link fr.tictak.courier.repository.OrderRepositoryCustom#applyTransition}.
 */
@Data
@NoArgsConstructor
@Document(collection = "orders")
public class Order {

    @Id
    private String id;

    @Indexed(unique = true)
    @Field("order_number")
    private String orderNumber;

    @Field("pickup_location")
    private Location pickupLocation;

    @Field("delivery_location")
    private Location deliveryLocation;

    // Weak reference to Agent.id, lookup only
    @Indexed
    @Field("assigned_agent_id")
    private String assignedAgentId;

    private OrderStatus status;

    @Field("customer_info")
    private CustomerInfo customerInfo;

    @Field("created_at")
    private Instant createdAt;

    @Field("started_at")
    private Instant startedAt;

    @Field("completed_at")
    private Instant completedAt;
}

package fr.tictak.courier.dto.out;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.tictak.courier.model.CustomerInfo;
import fr.tictak.courier.model.Location;
import fr.tictak.courier.model.Order;
import fr.tictak.courier.model.enums.OrderStatus;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderResponse(
        @JsonProperty("id") String id,
        @JsonProperty("order_number") String orderNumber,
        @JsonProperty("pickup_location") Location pickupLocation,
        @JsonProperty("delivery_location") Location deliveryLocation,
        @JsonProperty("assigned_agent_id") String assignedAgentId,
        @JsonProperty("status") OrderStatus status,
        @JsonProperty("customer_info") CustomerInfo customerInfo,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt
) {

    public static OrderResponse from(Order order) {
        return new OrderResponse(
                order.getId(),
                order.getOrderNumber(),
                order.getPickupLocation(),
                order.getDeliveryLocation(),
                order.getAssignedAgentId(),
                order.getStatus(),
                order.getCustomerInfo(),
                order.getCreatedAt(),
                order.getStartedAt(),
                order.getCompletedAt()
        );
    }
}

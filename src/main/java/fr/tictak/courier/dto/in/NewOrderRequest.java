package fr.tictak.courier.dto.in;

import fr.tictak.courier.model.CustomerInfo;
import fr.tictak.courier.model.Location;

/**
 * Provisioning input for a new order. Status and timestamps are always assigned by the server.
 */
public record NewOrderRequest(
        String orderNumber,
        Location pickupLocation,
        Location deliveryLocation,
        String assignedAgentId,
        CustomerInfo customerInfo
) {}

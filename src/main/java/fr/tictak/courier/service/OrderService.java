package fr.tictak.courier.service;

import fr.tictak.courier.dto.in.NewOrderRequest;
import fr.tictak.courier.model.Order;

import java.util.List;

public interface OrderService {

    /**
     * Orders assigned to the given agent, capped at the configured page size.
     * An unknown agent yields an empty list.
     */
    List<Order> findAssigned(String agentId);

    /**
     * @throws fr.tictak.courier.exception.ResourceNotFoundException if the id is unknown or malformed
     */
    Order findById(String orderId);

    /**
     * Moves a {@code pending} order to {@code in_progress} and stamps {@code startedAt}.
     *
     * @throws fr.tictak.courier.exception.ResourceNotFoundException   if the order does not exist
     * @throws fr.tictak.courier.exception.InvalidTransitionException if the order is not pending
     */
    Order start(String orderId);

    /**
     * Moves an {@code in_progress} order to {@code completed} and stamps {@code completedAt}.
     *
     * @throws fr.tictak.courier.exception.ResourceNotFoundException   if the order does not exist
     * @throws fr.tictak.courier.exception.InvalidTransitionException if the order is not in progress
     */
    Order complete(String orderId);

    Order create(NewOrderRequest request);
}

package fr.tictak.courier.repository;

import fr.tictak.courier.model.Order;
import fr.tictak.courier.model.enums.OrderStatus;

import java.time.Instant;
import java.util.Optional;

public interface OrderRepositoryCustom {

    /**
     * Atomically moves an order from {@code expected} to {@code target} and stamps the timestamp
     * property that {@code target} owns with {@code at}.
     *
     * @return the updated order, or empty when no order with that id currently holds {@code expected}
     */
    Optional<Order> applyTransition(String orderId, OrderStatus expected, OrderStatus target, Instant at);
}

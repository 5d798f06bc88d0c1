package fr.tictak.courier.service.implementation;

import fr.tictak.courier.dto.in.NewOrderRequest;
import fr.tictak.courier.exception.BadRequestException;
import fr.tictak.courier.exception.InvalidTransitionException;
import fr.tictak.courier.exception.ResourceNotFoundException;
import fr.tictak.courier.model.Order;
import fr.tictak.courier.model.enums.OrderStatus;
import fr.tictak.courier.repository.AgentRepository;
import fr.tictak.courier.repository.OrderRepository;
import fr.tictak.courier.service.OrderService;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Slf4j
@Service
public class OrderServiceImpl implements OrderService {

    private final OrderRepository orderRepository;
    private final AgentRepository agentRepository;
    private final int pageSize;

    public OrderServiceImpl(OrderRepository orderRepository,
                            AgentRepository agentRepository,
                            @Value("${courier.orders.page-size:100}") int pageSize) {
        this.orderRepository = orderRepository;
        this.agentRepository = agentRepository;
        this.pageSize = pageSize;
    }

    @Override
    public List<Order> findAssigned(String agentId) {
        List<Order> orders = orderRepository.findByAssignedAgentId(agentId, PageRequest.of(0, pageSize));
        log.debug("Found {} order(s) assigned to agent {}", orders.size(), agentId);
        return orders;
    }

    @Override
    public Order findById(String orderId) {
        if (!ObjectId.isValid(orderId)) {
            log.warn("Malformed order id: {}", orderId);
            throw orderNotFound(orderId);
        }
        return orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: {}", orderId);
                    return orderNotFound(orderId);
                });
    }

    @Override
    public Order start(String orderId) {
        return transition(orderId, OrderStatus.IN_PROGRESS);
    }

    @Override
    public Order complete(String orderId) {
        return transition(orderId, OrderStatus.COMPLETED);
    }

    private Order transition(String orderId, OrderStatus target) {
        if (!ObjectId.isValid(orderId)) {
            log.warn("Malformed order id for transition to {}: {}", target, orderId);
            throw orderNotFound(orderId);
        }

        OrderStatus expected = OrderStatus.predecessorOf(target);
        Instant now = Instant.now();

        return orderRepository.applyTransition(orderId, expected, target, now)
                .map(order -> {
                    log.info("Order {} ({}) moved {} -> {}", orderId, order.getOrderNumber(), expected, target);
                    return order;
                })
                .orElseThrow(() -> rejectedTransition(orderId, target));
    }

    // The conditional update matched nothing: tell a missing order apart from a stale status
    private RuntimeException rejectedTransition(String orderId, OrderStatus target) {
        return orderRepository.findById(orderId)
                .<RuntimeException>map(current -> {
                    log.warn("Rejected transition of order {} from {} to {}", orderId, current.getStatus(), target);
                    return new InvalidTransitionException(orderId, current.getStatus(), target);
                })
                .orElseGet(() -> {
                    log.warn("Order not found for transition to {}: {}", target, orderId);
                    return orderNotFound(orderId);
                });
    }

    @Override
    public Order create(NewOrderRequest request) {
        if (request.orderNumber() == null || request.orderNumber().isBlank()) {
            throw new BadRequestException("Order number is required");
        }
        if (request.assignedAgentId() == null || !agentRepository.existsById(request.assignedAgentId())) {
            log.warn("Cannot create order {}: agent {} does not exist", request.orderNumber(), request.assignedAgentId());
            throw new ResourceNotFoundException("Agent not found: " + request.assignedAgentId());
        }
        if (orderRepository.existsByOrderNumber(request.orderNumber())) {
            log.warn("Order number already used: {}", request.orderNumber());
            throw new BadRequestException("Order number already exists: " + request.orderNumber());
        }

        Order order = new Order();
        order.setOrderNumber(request.orderNumber());
        order.setPickupLocation(request.pickupLocation());
        order.setDeliveryLocation(request.deliveryLocation());
        order.setAssignedAgentId(request.assignedAgentId());
        order.setCustomerInfo(request.customerInfo());
        order.setStatus(OrderStatus.PENDING);
        order.setCreatedAt(Instant.now());

        Order saved = orderRepository.save(order);
        log.info("Order {} created for agent {}", saved.getOrderNumber(), saved.getAssignedAgentId());
        return saved;
    }

    private ResourceNotFoundException orderNotFound(String orderId) {
        return new ResourceNotFoundException("Order not found: " + orderId);
    }
}

package fr.tictak.courier.controller;

import fr.tictak.courier.dto.out.OrderResponse;
import fr.tictak.courier.exception.GlobalExceptionHandler;
import fr.tictak.courier.service.OrderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/orders")
@Tag(name = "Orders", description = "Assigned orders and their lifecycle (pending -> in_progress -> completed).")
public class OrderController {

    private static final Logger logger = LoggerFactory.getLogger(OrderController.class);

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    @Operation(summary = "Orders assigned to an agent", description = "Returns an empty list when the agent has no orders.")
    @GetMapping("/assigned/{agentId}")
    public ResponseEntity<List<OrderResponse>> getAssignedOrders(@PathVariable String agentId) {
        logger.info("Fetching orders assigned to agent {}", agentId);
        List<OrderResponse> orders = orderService.findAssigned(agentId).stream()
                .map(OrderResponse::from)
                .toList();
        return ResponseEntity.ok(orders);
    }

    @Operation(summary = "Order detail")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order found"),
            @ApiResponse(responseCode = "404", description = "Unknown or malformed order id",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = GlobalExceptionHandler.ErrorResponse.class)))
    })
    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable String orderId) {
        return ResponseEntity.ok(OrderResponse.from(orderService.findById(orderId)));
    }

    @Operation(summary = "Start an order", description = "Moves a pending order to in_progress.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order started"),
            @ApiResponse(responseCode = "404", description = "Unknown or malformed order id",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = GlobalExceptionHandler.ErrorResponse.class))),
            @ApiResponse(responseCode = "409", description = "Order is not pending",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = GlobalExceptionHandler.ErrorResponse.class)))
    })
    @PutMapping("/{orderId}/start")
    public ResponseEntity<Map<String, String>> startOrder(@PathVariable String orderId) {
        orderService.start(orderId);
        return ResponseEntity.ok(Map.of("message", "Order started successfully"));
    }

    @Operation(summary = "Complete an order", description = "Moves an in_progress order to completed.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order completed"),
            @ApiResponse(responseCode = "404", description = "Unknown or malformed order id",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = GlobalExceptionHandler.ErrorResponse.class))),
            @ApiResponse(responseCode = "409", description = "Order is not in progress",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = GlobalExceptionHandler.ErrorResponse.class)))
    })
    @PutMapping("/{orderId}/complete")
    public ResponseEntity<Map<String, String>> completeOrder(@PathVariable String orderId) {
        orderService.complete(orderId);
        return ResponseEntity.ok(Map.of("message", "Order completed successfully"));
    }
}

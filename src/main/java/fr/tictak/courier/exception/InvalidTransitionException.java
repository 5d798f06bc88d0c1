package fr.tictak.courier.exception;

import fr.tictak.courier.model.enums.OrderStatus;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Raised when an order is asked to move to a status its current status does not lead to.
 */
@Getter
public class InvalidTransitionException extends ApiException {

    private final String orderId;
    private final OrderStatus currentStatus;
    private final OrderStatus requestedStatus;

    public InvalidTransitionException(String orderId, OrderStatus currentStatus, OrderStatus requestedStatus) {
        super(HttpStatus.CONFLICT, "Order " + orderId + " cannot move from "
                + describe(currentStatus) + " to " + describe(requestedStatus));
        this.orderId = orderId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    private static String describe(OrderStatus status) {
        return status != null ? status.getValue() : "unknown";
    }
}

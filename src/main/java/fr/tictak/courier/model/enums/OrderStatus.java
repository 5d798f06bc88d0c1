package fr.tictak.courier.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Lifecycle of a delivery order. Each status knows its single legal successor and the
 * timestamp property stamped when an order enters it.
 */
@Getter
public enum OrderStatus {
    PENDING("pending", "createdAt"),
    IN_PROGRESS("in_progress", "startedAt"),
    COMPLETED("completed", "completedAt");

    private final String value;
    private final String timestampField;

    OrderStatus(String value, String timestampField) {
        this.value = value;
        this.timestampField = timestampField;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a stored or wire value. Accepts the lowercase value as well as the constant name.
     */
    public static OrderStatus fromValue(String value) {
        for (OrderStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown order status: " + value);
    }

    public OrderStatus next() {
        return switch (this) {
            case PENDING -> IN_PROGRESS;
            case IN_PROGRESS, COMPLETED -> COMPLETED;
        };
    }

    public boolean isTerminal() {
        return next() == this;
    }

    public boolean canTransitionTo(OrderStatus target) {
        return target != null && !isTerminal() && next() == target;
    }

    /**
     * The status an order must currently hold to be moved into {@code target}.
     */
    public static OrderStatus predecessorOf(OrderStatus target) {
        for (OrderStatus candidate : values()) {
            if (candidate.canTransitionTo(target)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("No transition leads to " + target);
    }
}

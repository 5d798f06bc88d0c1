package fr.tictak.courier.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum AgentStatus {
    ACTIVE("active"),
    INACTIVE("inactive");

    private final String value;

    AgentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a stored or wire value. Accepts the lowercase value as well as the constant name.
     */
    public static AgentStatus fromValue(String value) {
        for (AgentStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown agent status: " + value);
    }
}

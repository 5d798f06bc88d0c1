package fr.tictak.courier.dto.out;

import fr.tictak.courier.model.Agent;

public record AuthResponse(
        String id,
        String username,
        String name,
        String phone,
        String status,
        String token
) {

    public static AuthResponse of(Agent agent, String token) {
        return new AuthResponse(
                agent.getId(),
                agent.getUsername(),
                agent.getName(),
                agent.getPhone(),
                agent.getStatus() != null ? agent.getStatus().getValue() : null,
                token
        );
    }
}

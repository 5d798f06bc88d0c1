package fr.tictak.courier.model;

import fr.tictak.courier.model.enums.AgentStatus;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

@Data
@NoArgsConstructor
@Document(collection = "delivery_agents")
public class Agent {

    @Id
    private String id;

    @Indexed(unique = true)
    private String username;

    private String name;
    private String phone;
    private AgentStatus status;

    // BCrypt hash, never the raw password
    private String password;

    @Field("created_at")
    private Instant createdAt;

    public boolean isActive() {
        return status == AgentStatus.ACTIVE;
    }
}

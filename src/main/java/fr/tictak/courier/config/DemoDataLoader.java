package fr.tictak.courier.config;

import fr.tictak.courier.dto.in.NewOrderRequest;
import fr.tictak.courier.model.Agent;
import fr.tictak.courier.model.CustomerInfo;
import fr.tictak.courier.model.Location;
import fr.tictak.courier.model.enums.AgentStatus;
import fr.tictak.courier.repository.AgentRepository;
import fr.tictak.courier.service.OrderService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Seeds a test agent and two pending orders on first start.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "courier.seed.enabled", havingValue = "true")
public class DemoDataLoader implements CommandLineRunner {

    static final String DEMO_USERNAME = "agent1";
    static final String DEMO_PASSWORD = "password123";

    private final AgentRepository agentRepository;
    private final OrderService orderService;
    private final PasswordEncoder passwordEncoder;

    public DemoDataLoader(AgentRepository agentRepository,
                          OrderService orderService,
                          PasswordEncoder passwordEncoder) {
        this.agentRepository = agentRepository;
        this.orderService = orderService;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public void run(String... args) {
        if (agentRepository.existsByUsername(DEMO_USERNAME)) {
            return;
        }

        Agent agent = new Agent();
        agent.setUsername(DEMO_USERNAME);
        agent.setPassword(passwordEncoder.encode(DEMO_PASSWORD));
        agent.setName("John Doe");
        agent.setPhone("+1234567890");
        agent.setStatus(AgentStatus.ACTIVE);
        agent.setCreatedAt(Instant.now());
        Agent saved = agentRepository.save(agent);

        orderService.create(new NewOrderRequest(
                "ORD001",
                new Location(37.7749, -122.4194, "123 Market St, San Francisco, CA"),
                new Location(37.8044, -122.2712, "456 Broadway, Oakland, CA"),
                saved.getId(),
                new CustomerInfo("Alice Johnson", "+1234567891")));
        orderService.create(new NewOrderRequest(
                "ORD002",
                new Location(37.8044, -122.2712, "789 Main St, Oakland, CA"),
                new Location(37.7749, -122.4194, "321 Mission St, San Francisco, CA"),
                saved.getId(),
                new CustomerInfo("Bob Smith", "+1234567892")));

        log.info("Demo data created: agent {} with orders ORD001, ORD002", DEMO_USERNAME);
    }
}

package fr.tictak.courier.service.implementation;

import fr.tictak.courier.dto.in.LoginRequest;
import fr.tictak.courier.dto.out.AuthResponse;
import fr.tictak.courier.exception.UnauthorizedException;
import fr.tictak.courier.model.Agent;
import fr.tictak.courier.repository.AgentRepository;
import fr.tictak.courier.security.JwtUtils;
import fr.tictak.courier.service.AuthService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class AuthServiceImpl implements AuthService {

    static final String INVALID_CREDENTIALS = "Invalid credentials";

    private final AgentRepository agentRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtUtils jwtUtils;

    public AuthServiceImpl(AgentRepository agentRepository,
                           PasswordEncoder passwordEncoder,
                           JwtUtils jwtUtils) {
        this.agentRepository = agentRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtUtils = jwtUtils;
    }

    @Override
    public AuthResponse login(LoginRequest request) {
        log.info("Login attempt for username: {}", request.username());
        Agent agent = agentRepository.findByUsername(request.username()).orElse(null);
        if (agent == null) {
            log.warn("Login failed: unknown username {}", request.username());
            throw new UnauthorizedException(INVALID_CREDENTIALS);
        }
        if (!passwordEncoder.matches(request.password(), agent.getPassword())) {
            log.warn("Login failed: wrong password for username {}", request.username());
            throw new UnauthorizedException(INVALID_CREDENTIALS);
        }

        String token = jwtUtils.generateAccessToken(agent);
        log.info("Login succeeded for agent {} ({})", agent.getId(), agent.getUsername());
        return AuthResponse.of(agent, token);
    }
}

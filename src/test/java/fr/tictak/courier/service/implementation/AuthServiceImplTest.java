package fr.tictak.courier.service.implementation;

import fr.tictak.courier.dto.in.LoginRequest;
import fr.tictak.courier.dto.out.AuthResponse;
import fr.tictak.courier.exception.UnauthorizedException;
import fr.tictak.courier.model.Agent;
import fr.tictak.courier.model.enums.AgentStatus;
import fr.tictak.courier.repository.AgentRepository;
import fr.tictak.courier.security.JwtUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class AuthServiceImplTest {

    @Mock
    private AgentRepository agentRepository;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder();
    private JwtUtils jwtUtils;
    private AuthServiceImpl authService;
    private Agent agent;

    @BeforeEach
    void setUp() {
        jwtUtils = new JwtUtils();
        ReflectionTestUtils.setField(jwtUtils, "jwtSecret", "test-secret-key-that-is-long-enough-for-hs256");
        ReflectionTestUtils.setField(jwtUtils, "accessTokenExpirationMs", 60_000L);
        authService = new AuthServiceImpl(agentRepository, passwordEncoder, jwtUtils);

        agent = new Agent();
        agent.setId("665f1c2e9b1d8a3f4c2e7a10");
        agent.setUsername("agent1");
        agent.setName("John Doe");
        agent.setPhone("+1234567890");
        agent.setStatus(AgentStatus.ACTIVE);
        agent.setPassword(passwordEncoder.encode("password123"));
    }

    @Test
    @DisplayName("Valid credentials return the stored profile and a usable token")
    void login_Success() {
        given(agentRepository.findByUsername("agent1")).willReturn(Optional.of(agent));

        AuthResponse response = authService.login(new LoginRequest("agent1", "password123"));

        assertThat(response.id()).isEqualTo(agent.getId());
        assertThat(response.username()).isEqualTo("agent1");
        assertThat(response.name()).isEqualTo("John Doe");
        assertThat(response.phone()).isEqualTo("+1234567890");
        assertThat(response.status()).isEqualTo("active");
        assertThat(response.token()).isNotBlank();
        assertThat(jwtUtils.getAgentIdFromToken(response.token())).isEqualTo(agent.getId());
    }

    @Test
    @DisplayName("Unknown username and wrong password fail identically")
    void login_Failures_Indistinguishable() {
        given(agentRepository.findByUsername("agent1")).willReturn(Optional.of(agent));
        given(agentRepository.findByUsername("invalid_user")).willReturn(Optional.empty());

        Throwable wrongPassword = catchThrowable(() -> authService.login(new LoginRequest("agent1", "wrong_password")));
        Throwable unknownUser = catchThrowable(() -> authService.login(new LoginRequest("invalid_user", "password123")));

        assertThat(wrongPassword).isInstanceOf(UnauthorizedException.class);
        assertThat(unknownUser).isInstanceOf(UnauthorizedException.class);
        assertThat(wrongPassword.getClass()).isEqualTo(unknownUser.getClass());
        assertThat(wrongPassword.getMessage()).isEqualTo(unknownUser.getMessage());
    }
}

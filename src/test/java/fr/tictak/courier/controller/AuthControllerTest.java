package fr.tictak.courier.controller;

import fr.tictak.courier.dto.in.LoginRequest;
import fr.tictak.courier.dto.out.AuthResponse;
import fr.tictak.courier.exception.UnauthorizedException;
import fr.tictak.courier.security.CustomAuthenticationEntryPoint;
import fr.tictak.courier.security.JwtUtils;
import fr.tictak.courier.security.SecurityConfig;
import fr.tictak.courier.service.AuthService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AuthController.class)
@Import({SecurityConfig.class, JwtUtils.class, CustomAuthenticationEntryPoint.class})
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuthService authService;

    @Test
    @DisplayName("Login returns the agent profile and token")
    void login_Success() throws Exception {
        given(authService.login(new LoginRequest("agent1", "password123"))).willReturn(new AuthResponse(
                "665f1c2e9b1d8a3f4c2e7a10", "agent1", "John Doe", "+1234567890", "active", "jwt-token"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"agent1\",\"password\":\"password123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("665f1c2e9b1d8a3f4c2e7a10"))
                .andExpect(jsonPath("$.username").value("agent1"))
                .andExpect(jsonPath("$.name").value("John Doe"))
                .andExpect(jsonPath("$.phone").value("+1234567890"))
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.token").value("jwt-token"));
    }

    @Test
    @DisplayName("Bad credentials are 401")
    void login_BadCredentials() throws Exception {
        given(authService.login(any())).willThrow(new UnauthorizedException("Invalid credentials"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"invalid_user\",\"password\":\"wrong_password\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid credentials"));
    }

    @Test
    @DisplayName("Blank fields are rejected before reaching the service")
    void login_BlankUsername() throws Exception {
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"\",\"password\":\"password123\"}"))
                .andExpect(status().isUnprocessableEntity());

        verifyNoInteractions(authService);
    }
}

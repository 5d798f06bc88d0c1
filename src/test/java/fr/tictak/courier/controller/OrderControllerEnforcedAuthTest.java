package fr.tictak.courier.controller;

import fr.tictak.courier.model.Agent;
import fr.tictak.courier.security.CustomAuthenticationEntryPoint;
import fr.tictak.courier.security.JwtUtils;
import fr.tictak.courier.security.SecurityConfig;
import fr.tictak.courier.service.OrderService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = OrderController.class, properties = "courier.security.enforce-auth=true")
@Import({SecurityConfig.class, JwtUtils.class, CustomAuthenticationEntryPoint.class})
class OrderControllerEnforcedAuthTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtUtils jwtUtils;

    @MockBean
    private OrderService orderService;

    @Test
    @DisplayName("Without a token, order endpoints answer 401 in JSON")
    void missingToken_Unauthorized() throws Exception {
        mockMvc.perform(get("/api/orders/assigned/{agentId}", "a1"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));
    }

    @Test
    @DisplayName("A token issued at login opens order endpoints")
    void validToken_Ok() throws Exception {
        Agent agent = new Agent();
        agent.setId("a1");
        agent.setUsername("agent1");
        String token = jwtUtils.generateAccessToken(agent);
        given(orderService.findAssigned("a1")).willReturn(List.of());

        mockMvc.perform(get("/api/orders/assigned/{agentId}", "a1")
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isOk());
    }
}

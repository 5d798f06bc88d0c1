package fr.tictak.courier.service;

import fr.tictak.courier.dto.in.LoginRequest;
import fr.tictak.courier.dto.out.AuthResponse;

public interface AuthService {

    /**
     * Checks the agent credentials and issues a session token.
     *
     * @throws fr.tictak.courier.exception.UnauthorizedException for an unknown username or a wrong
     *                                                            password, with the same message for both
     */
    AuthResponse login(LoginRequest request);
}

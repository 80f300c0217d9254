package com.nhoyhub.order.service;

import com.nhoyhub.order.config.OrderApiProperties;
import com.nhoyhub.order.exception.UnauthorizedException;
import com.nhoyhub.order.metrics.OrderMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Single fixed administrator. Login hands out one static bearer token that never expires;
 * authorization is an exact comparison against it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    public static final String TOKEN_TYPE = "bearer";

    private static final String BEARER_PREFIX = "Bearer ";

    private final OrderApiProperties properties;
    private final OrderMetrics orderMetrics;

    public String login(String username, String password) {
        OrderApiProperties.Admin admin = properties.getAdmin();
        if (!admin.getUsername().equals(username) || !admin.getPassword().equals(password)) {
            log.warn("Rejected login attempt for user: {}", username);
            orderMetrics.incrementLoginFailures();
            throw new UnauthorizedException("Incorrect username or password");
        }
        log.info("Admin logged in: {}", username);
        return admin.getToken();
    }

    /**
     * @param authorizationHeader raw {@code Authorization} header value, may be null
     * @return the admin username
     */
    public String authorize(String authorizationHeader) {
        if (authorizationHeader == null
                || authorizationHeader.length() < BEARER_PREFIX.length()
                || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            orderMetrics.incrementTokenRejections();
            throw new UnauthorizedException("Not authenticated");
        }

        String token = authorizationHeader.substring(BEARER_PREFIX.length());
        if (!properties.getAdmin().getToken().equals(token)) {
            log.warn("Rejected request with invalid bearer token");
            orderMetrics.incrementTokenRejections();
            throw new UnauthorizedException("Invalid authentication credentials");
        }
        return properties.getAdmin().getUsername();
    }
}

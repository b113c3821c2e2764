package com.keer.seating.auth;

import com.keer.seating.common.exception.UnauthorizedException;
import com.keer.seating.config.SeatingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@Component
@Slf4j
public class AdminTokenVerifier {

    static final String PRINCIPAL = "admin";
    private static final String BEARER_PREFIX = "Bearer ";

    private final byte[] expected;

    public AdminTokenVerifier(SeatingProperties properties) {
        String token = properties.getAdmin().getToken();
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("seating.admin.token must be configured");
        }
        this.expected = token.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @param authorization raw {@code Authorization} header value, may be null
     */
    public AdminGrant verify(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            throw new UnauthorizedException("Missing admin bearer token");
        }
        byte[] presented = authorization.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, presented)) {
            log.warn("Rejected request with an invalid admin token");
            throw new UnauthorizedException("Invalid admin bearer token");
        }
        return new AdminGrant(PRINCIPAL);
    }
}

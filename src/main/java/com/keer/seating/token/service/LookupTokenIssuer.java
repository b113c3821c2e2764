package com.keer.seating.token.service;

import com.keer.seating.config.SeatingProperties;
import com.keer.seating.token.model.IssuedToken;
import com.keer.seating.token.repository.IssuedTokenRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriComponentsBuilder;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Arrays;
import java.util.Base64;

/**
 * Mints and verifies guest lookup tokens.
 * <p>
 * A token is {@code base64url(random) "." base64url(truncated HMAC-SHA256(secret, random))}.
 * Verification only checks the signature; resolving a token to a guest is the engine's job.
 * Every minted token is written to the issued-token registry, which is never pruned, so a
 * token can never be handed to a second guest.
 */
@Service
@Slf4j
public class LookupTokenIssuer {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int RANDOM_BYTES = 16;
    private static final int SIGNATURE_BYTES = 12;
    private static final int MAX_MINT_ATTEMPTS = 5;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final IssuedTokenRepository issuedTokenRepository;
    private final SecretKeySpec key;
    private final String portalBaseUrl;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public LookupTokenIssuer(IssuedTokenRepository issuedTokenRepository, SeatingProperties properties, Clock clock) {
        String secret = properties.getToken().getSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("seating.token.secret must be configured");
        }
        this.issuedTokenRepository = issuedTokenRepository;
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
        this.portalBaseUrl = properties.getToken().getPortalBaseUrl();
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public String mint() {
        for (int attempt = 1; attempt <= MAX_MINT_ATTEMPTS; attempt++) {
            byte[] nonce = new byte[RANDOM_BYTES];
            random.nextBytes(nonce);
            String token = ENCODER.encodeToString(nonce) + "." + ENCODER.encodeToString(sign(nonce));

            if (!issuedTokenRepository.existsById(token)) {
                issuedTokenRepository.save(new IssuedToken(token, clock.instant()));
                return token;
            }
            log.warn("Minted token collided with an issued one, attempt {}", attempt);
        }
        throw new IllegalStateException("Could not mint a unique lookup token");
    }

    /**
     * Pure signature check, no store access.
     */
    public boolean verify(String token) {
        if (token == null) {
            return false;
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot == token.length() - 1 || token.indexOf('.', dot + 1) >= 0) {
            return false;
        }
        try {
            byte[] nonce = DECODER.decode(token.substring(0, dot));
            byte[] signature = DECODER.decode(token.substring(dot + 1));
            return nonce.length == RANDOM_BYTES && MessageDigest.isEqual(sign(nonce), signature);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public String portalLink(String token) {
        return UriComponentsBuilder.fromHttpUrl(portalBaseUrl)
                .path("/guest/portal")
                .queryParam("token", token)
                .toUriString();
    }

    private byte[] sign(byte[] nonce) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            return Arrays.copyOf(mac.doFinal(nonce), SIGNATURE_BYTES);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
